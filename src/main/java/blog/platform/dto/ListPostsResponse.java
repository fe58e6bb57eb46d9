package blog.platform.dto;

import blog.platform.domain.ListPostsResult;
import blog.platform.domain.PageRequest;
import blog.platform.service.Pagination;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One page of posts in limit/offset terms
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Paged post listing")
public class ListPostsResponse {

    private List<PostResponse> posts;

    @Schema(description = "Page size actually used", example = "20")
    private Integer limit;

    @Schema(description = "Offset of the first returned post, rounded down to a page boundary", example = "40")
    private Long offset;

    @Schema(description = "Total number of posts", example = "42")
    private Long total;

    public static ListPostsResponse fromResult(ListPostsResult result) {
        PageRequest page = new PageRequest(result.getPage(), result.getPageSize());
        return ListPostsResponse.builder()
                .posts(result.getPosts().stream().map(PostResponse::fromPost).collect(Collectors.toList()))
                .limit(result.getPageSize())
                .offset(Pagination.toOffset(page))
                .total(Math.max(0, result.getTotal()))
                .build();
    }
}
