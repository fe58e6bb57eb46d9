package blog.platform.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * MyBatis mapper for the users table
 */
@Mapper
public interface UserMapper {
    /**
     * Insert a new user; the generated id is written back to the row
     * @return number of rows affected
     */
    int insert(UserRow row);

    /**
     * Find user by username
     */
    UserRow findByUsername(@Param("username") String username);

    /**
     * Find user by email
     */
    UserRow findByEmail(@Param("email") String email);
}
