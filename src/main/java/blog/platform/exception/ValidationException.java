package blog.platform.exception;

import lombok.Getter;

/**
 * Input failed validation or normalization.
 * Carries the offending field and a short reason.
 */
@Getter
public class ValidationException extends BusinessException {

    private final String field;

    private final String reason;

    public ValidationException(String field, String reason) {
        super("validation failed for '" + field + "': " + reason);
        this.field = field;
        this.reason = reason;
    }
}
