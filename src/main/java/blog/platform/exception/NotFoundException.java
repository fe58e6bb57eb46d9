package blog.platform.exception;

import lombok.Getter;

/**
 * Requested resource does not exist
 */
@Getter
public class NotFoundException extends BusinessException {

    private final String resource;

    public NotFoundException(String resource) {
        super("resource not found: " + resource);
        this.resource = resource;
    }
}
