package blog.platform.store;

import blog.platform.domain.NewUser;
import blog.platform.domain.User;
import blog.platform.domain.UserCredentials;
import blog.platform.exception.AlreadyExistsException;
import blog.platform.exception.UnexpectedException;
import blog.platform.exception.ValidationException;
import blog.platform.mapper.UserMapper;
import blog.platform.mapper.UserRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relational {@link UserStore} backed by MyBatis
 */
@Slf4j
@Repository
public class MyBatisUserStore implements UserStore {

    static final String USERNAME_CONSTRAINT = "users_username_key";
    static final String EMAIL_CONSTRAINT = "users_email_key";

    private final UserMapper userMapper;

    public MyBatisUserStore(UserMapper userMapper) {
        this.userMapper = userMapper;
    }

    @Override
    public User create(NewUser newUser) {
        UserRow row = UserRow.builder()
                .username(newUser.getUsername())
                .email(newUser.getEmail())
                .passwordHash(newUser.getPasswordHash())
                .createdAt(newUser.getCreatedAt())
                .build();
        try {
            userMapper.insert(row);
        } catch (DuplicateKeyException e) {
            throw new AlreadyExistsException(conflictingField(e));
        } catch (DataAccessException e) {
            throw new UnexpectedException("insert user failed", e);
        }
        if (row.getId() == null) {
            throw new UnexpectedException("insert user returned no id");
        }
        return toUser(row);
    }

    @Override
    public Optional<UserCredentials> findByUsername(String username) {
        return query(() -> userMapper.findByUsername(username)).map(this::toCredentials);
    }

    @Override
    public Optional<UserCredentials> findByEmail(String email) {
        return query(() -> userMapper.findByEmail(email)).map(this::toCredentials);
    }

    /**
     * Resolve which unique constraint fired from the driver message.
     * PostgreSQL names the constraint; H2 names the backing index, which starts with it.
     */
    static String conflictingField(DuplicateKeyException e) {
        String message = String.valueOf(NestedExceptionUtils.getMostSpecificCause(e).getMessage())
                .toLowerCase(Locale.ROOT);
        if (message.contains(USERNAME_CONSTRAINT)) {
            return "username";
        }
        if (message.contains(EMAIL_CONSTRAINT)) {
            return "email";
        }
        return "user";
    }

    private Optional<UserRow> query(Supplier<UserRow> statement) {
        try {
            return Optional.ofNullable(statement.get());
        } catch (DataAccessException e) {
            throw new UnexpectedException("query users failed", e);
        }
    }

    private UserCredentials toCredentials(UserRow row) {
        return new UserCredentials(toUser(row), row.getPasswordHash());
    }

    private User toUser(UserRow row) {
        try {
            return User.of(row.getId(), row.getUsername(), row.getEmail(), row.getCreatedAt());
        } catch (ValidationException | NullPointerException e) {
            log.error("Stored user violates invariants: id={}", row.getId());
            throw new UnexpectedException("invalid user row " + row.getId(), e);
        }
    }
}
