package blog.platform.security;

import blog.platform.exception.UnexpectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Argon2id password hashing.
 *
 * Cost parameters: 19 MiB memory, 2 iterations, parallelism 1,
 * 16-byte random salt per hash, 32-byte digest. Output is a PHC string,
 * so verification always uses the parameters stored in the hash itself.
 */
@Slf4j
@Component
public class PasswordHasher {

    private static final int SALT_LENGTH = 16;
    private static final int HASH_LENGTH = 32;
    private static final int PARALLELISM = 1;
    private static final int MEMORY_KIB = 19 * 1024;
    private static final int ITERATIONS = 2;

    /**
     * Precomputed hash with the production cost parameters. Verified against when the
     * username is unknown so both login failure paths do the same amount of work.
     */
    public static final String DUMMY_HASH =
            "$argon2id$v=19$m=19456,t=2,p=1$MDEyMzQ1Njc4OWFiY2RlZg$gwN6hT1sNdk9kI95f7n2Gl3fL0qRmBf2Ffkj2r90/0M";

    private final Argon2PasswordEncoder encoder =
            new Argon2PasswordEncoder(SALT_LENGTH, HASH_LENGTH, PARALLELISM, MEMORY_KIB, ITERATIONS);

    /**
     * Hash a plaintext password with a fresh salt
     *
     * @param plaintext the password
     * @return PHC-encoded hash
     */
    public String hash(String plaintext) {
        try {
            return encoder.encode(plaintext);
        } catch (RuntimeException e) {
            throw new UnexpectedException("password hashing failed", e);
        }
    }

    /**
     * Verify a plaintext password against an encoded hash.
     * The digest comparison is constant-time.
     */
    public PasswordVerification verify(String plaintext, String encodedHash) {
        if (PhcHash.parse(encodedHash).isEmpty()) {
            log.warn("Stored password hash is malformed");
            return PasswordVerification.MALFORMED;
        }
        try {
            return encoder.matches(plaintext, encodedHash)
                    ? PasswordVerification.MATCH
                    : PasswordVerification.MISMATCH;
        } catch (RuntimeException e) {
            throw new UnexpectedException("password verification failed", e);
        }
    }
}
