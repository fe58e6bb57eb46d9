package blog.platform.service;

import blog.platform.domain.AuthResult;
import blog.platform.domain.NewUser;
import blog.platform.domain.Normalizer;
import blog.platform.domain.User;
import blog.platform.domain.UserCredentials;
import blog.platform.exception.AlreadyExistsException;
import blog.platform.exception.InvalidCredentialsException;
import blog.platform.exception.UnexpectedException;
import blog.platform.security.PasswordHasher;
import blog.platform.security.PasswordVerification;
import blog.platform.security.TokenService;
import blog.platform.store.UserStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Registration and login.
 *
 * Failures surface as ValidationException (field-tagged), AlreadyExistsException
 * (field-tagged), InvalidCredentialsException (untagged) or UnexpectedException.
 */
@Slf4j
@Service
public class AuthService {

    private final UserStore userStore;
    private final PasswordHasher passwordHasher;
    private final TokenService tokenService;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public AuthService(UserStore userStore,
                       PasswordHasher passwordHasher,
                       TokenService tokenService,
                       Clock clock,
                       MeterRegistry meterRegistry) {
        this.userStore = userStore;
        this.passwordHasher = passwordHasher;
        this.tokenService = tokenService;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Register a new user and issue a token for it
     *
     * @return the created user (without credential) and an access token
     */
    public AuthResult register(String username, String email, String password) {
        String normalizedUsername = Normalizer.registerUsername(username);
        String normalizedEmail = Normalizer.email(email);
        String validPassword = Normalizer.registerPassword(password);

        // fail fast before paying for a hash; the unique constraints remain authoritative
        if (userStore.findByUsername(normalizedUsername).isPresent()) {
            throw conflict("username");
        }
        if (userStore.findByEmail(normalizedEmail).isPresent()) {
            throw conflict("email");
        }

        String passwordHash = passwordHasher.hash(validPassword);

        User user;
        try {
            user = userStore.create(new NewUser(normalizedUsername, normalizedEmail, passwordHash,
                    clock.instant().truncatedTo(ChronoUnit.MICROS)));
        } catch (AlreadyExistsException e) {
            throw conflict(e.getField());
        }

        String token = tokenService.issue(user.getId(), user.getUsername());
        meterRegistry.counter("blog.auth.register", "outcome", "success").increment();
        log.info("User registered: userId={}, username={}", user.getId(), user.getUsername());
        return new AuthResult(user, token);
    }

    /**
     * Authenticate by username and password.
     *
     * An unknown username still pays for one hash verification against
     * {@link PasswordHasher#DUMMY_HASH}, and both failure paths raise the same
     * InvalidCredentialsException.
     */
    public AuthResult login(String username, String password) {
        String normalizedUsername = Normalizer.loginUsername(username);
        Normalizer.loginPassword(password);

        Optional<UserCredentials> found = userStore.findByUsername(normalizedUsername);
        if (found.isEmpty()) {
            equalizeTiming(password);
            throw invalidCredentials();
        }

        UserCredentials credentials = found.get();
        PasswordVerification verification = passwordHasher.verify(password, credentials.getPasswordHash());
        if (verification == PasswordVerification.MALFORMED) {
            throw new UnexpectedException("stored password hash is malformed for user " + credentials.getUser().getId());
        }
        if (verification != PasswordVerification.MATCH) {
            throw invalidCredentials();
        }

        User user = credentials.getUser();
        String token = tokenService.issue(user.getId(), user.getUsername());
        meterRegistry.counter("blog.auth.login", "outcome", "success").increment();
        log.info("User logged in: userId={}", user.getId());
        return new AuthResult(user, token);
    }

    private void equalizeTiming(String password) {
        try {
            passwordHasher.verify(password, PasswordHasher.DUMMY_HASH);
        } catch (UnexpectedException e) {
            log.debug("Dummy hash verification failed: {}", e.getMessage());
        }
    }

    private AlreadyExistsException conflict(String field) {
        meterRegistry.counter("blog.auth.register", "outcome", "conflict").increment();
        log.warn("Registration conflict on field: {}", field);
        return new AlreadyExistsException(field);
    }

    private InvalidCredentialsException invalidCredentials() {
        meterRegistry.counter("blog.auth.login", "outcome", "invalid_credentials").increment();
        log.warn("Login failed: invalid credentials");
        return new InvalidCredentialsException();
    }
}
