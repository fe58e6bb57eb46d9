package blog.platform.mapper;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Row of the users table
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRow {
    /**
     * Generated identifier
     */
    private Long id;

    /**
     * Username (unique)
     */
    private String username;

    /**
     * Email address (unique, lower-cased)
     */
    private String email;

    /**
     * Argon2id hash in PHC format
     */
    private String passwordHash;

    private Instant createdAt;
}
