package blog.platform.exception;

import lombok.Getter;

/**
 * A uniqueness constraint fired; field names the conflicting attribute
 */
@Getter
public class AlreadyExistsException extends BusinessException {

    private final String field;

    public AlreadyExistsException(String field) {
        super("resource already exists: " + field);
        this.field = field;
    }
}
