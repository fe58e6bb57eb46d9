package blog.platform.client;

import lombok.Getter;

/**
 * Failure reported by a {@link BlogClient}, classified independently of the transport
 */
@Getter
public class BlogClientException extends RuntimeException {

    public enum Kind {
        /** 401/403, UNAUTHENTICATED/PERMISSION_DENIED, or no token set */
        UNAUTHORIZED,
        NOT_FOUND,
        /** Any other rejection of the request by the server */
        INVALID_REQUEST,
        /** Connection failures, timeouts and server faults */
        TRANSPORT
    }

    private final Kind kind;

    public BlogClientException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BlogClientException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
