package blog.platform.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

/**
 * MyBatis mapper for the posts table
 */
@Mapper
public interface PostMapper {

    /**
     * Insert a new post; the generated id is written back to the row
     * @return number of rows affected
     */
    int insert(PostRow row);

    /**
     * Find post by ID
     * @return the post, or null if not found
     */
    PostRow findById(@Param("id") Long id);

    /**
     * Replace title and content, only if the post is owned by ownerId
     * @return number of rows affected (0 when missing or not owned)
     */
    int updateOwned(@Param("id") Long id,
                    @Param("ownerId") Long ownerId,
                    @Param("title") String title,
                    @Param("content") String content,
                    @Param("updatedAt") Instant updatedAt);

    /**
     * Delete post, only if owned by ownerId
     * @return number of rows affected
     */
    int deleteOwned(@Param("id") Long id, @Param("ownerId") Long ownerId);

    /**
     * Newest first, ties broken by id descending
     */
    List<PostRow> findPage(@Param("offset") long offset, @Param("limit") int limit);

    long countAll();
}
