package blog.platform.store;

import blog.platform.domain.NewUser;
import blog.platform.domain.User;
import blog.platform.domain.UserCredentials;

import java.util.Optional;

/**
 * Persistence for users and their credentials.
 *
 * Implementations translate backend errors: a unique-constraint violation becomes
 * {@link blog.platform.exception.AlreadyExistsException} naming the field,
 * anything else becomes {@link blog.platform.exception.UnexpectedException}.
 */
public interface UserStore {

    User create(NewUser newUser);

    Optional<UserCredentials> findByUsername(String username);

    Optional<UserCredentials> findByEmail(String email);
}
