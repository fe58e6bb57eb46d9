package blog.platform.domain;

import lombok.Value;

import java.util.List;

/**
 * One page of posts plus the unwindowed total.
 * total comes from a separate count query and may briefly disagree with posts.
 */
@Value
public class ListPostsResult {
    List<Post> posts;
    int page;
    int pageSize;
    long total;
}
