package blog.platform.domain;

import blog.platform.exception.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization and validation rules shared by the domain entities and services.
 * Every rule trims before measuring; lengths are counted in code points.
 */
public final class Normalizer {

    public static final int USERNAME_MIN = 3;
    public static final int USERNAME_MAX = 64;
    public static final int PASSWORD_MIN = 8;
    public static final int PASSWORD_MAX = 128;
    public static final int TITLE_MAX = 255;
    public static final int EMAIL_MAX = 254;
    public static final int EMAIL_LOCAL_PART_MAX = 64;

    private static final Pattern EMAIL = Pattern.compile(
            "^[a-zA-Z0-9.!#$%&'*+/=?^_`{|}~-]+"
                    + "@[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?"
                    + "(?:\\.[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*$");

    private Normalizer() {
    }

    public static String registerUsername(String username) {
        String value = trim(username);
        int length = length(value);
        if (length < USERNAME_MIN || length > USERNAME_MAX) {
            throw new ValidationException("username", "must be 3..64 chars");
        }
        return value;
    }

    public static String loginUsername(String username) {
        String value = trim(username);
        int length = length(value);
        if (length < 1 || length > USERNAME_MAX) {
            throw new ValidationException("username", "must be 1..64 chars");
        }
        return value;
    }

    public static String email(String email) {
        String value = trim(email).toLowerCase(Locale.ROOT);
        int at = value.indexOf('@');
        if (value.length() > EMAIL_MAX || at > EMAIL_LOCAL_PART_MAX || !EMAIL.matcher(value).matches()) {
            throw new ValidationException("email", "must be a valid email");
        }
        return value;
    }

    /**
     * Password is not trimmed: surrounding whitespace is part of the secret.
     */
    public static String registerPassword(String password) {
        int length = password == null ? 0 : length(password);
        if (length < PASSWORD_MIN || length > PASSWORD_MAX) {
            throw new ValidationException("password", "must be 8..128 chars");
        }
        return password;
    }

    public static String loginPassword(String password) {
        if (password == null || password.isEmpty()) {
            throw new ValidationException("password", "must not be empty");
        }
        return password;
    }

    public static String title(String title) {
        String value = trim(title);
        int length = length(value);
        if (length < 1 || length > TITLE_MAX) {
            throw new ValidationException("title", "must be 1..255 chars");
        }
        return value;
    }

    public static String content(String content) {
        String value = trim(content);
        if (value.isEmpty()) {
            throw new ValidationException("content", "must not be empty");
        }
        return value;
    }

    public static long positive(String field, long value) {
        if (value <= 0) {
            throw new ValidationException(field, "must be > 0");
        }
        return value;
    }

    private static String trim(String value) {
        return value == null ? "" : value.strip();
    }

    private static int length(String value) {
        return value.codePointCount(0, value.length());
    }
}
