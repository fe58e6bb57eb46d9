package blog.platform.grpc;

import blog.platform.exception.AlreadyExistsException;
import blog.platform.exception.ForbiddenException;
import blog.platform.exception.InvalidCredentialsException;
import blog.platform.exception.NotFoundException;
import blog.platform.exception.UnauthorizedException;
import blog.platform.exception.ValidationException;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import lombok.extern.slf4j.Slf4j;

/**
 * gRPC counterpart of the REST exception handler.
 * Anything not recognised becomes INTERNAL with a generic description.
 */
@Slf4j
final class GrpcStatusMapper {

    static final String INTERNAL_DESCRIPTION = "internal error";

    private GrpcStatusMapper() {
    }

    static StatusRuntimeException toStatus(Throwable error) {
        if (error instanceof StatusRuntimeException statusError) {
            return statusError;
        }
        if (error instanceof ValidationException) {
            log.warn("Validation failed: {}", error.getMessage());
            return Status.INVALID_ARGUMENT.withDescription(error.getMessage()).asRuntimeException();
        }
        if (error instanceof AlreadyExistsException) {
            log.warn("Conflict: {}", error.getMessage());
            return Status.ALREADY_EXISTS.withDescription(error.getMessage()).asRuntimeException();
        }
        if (error instanceof InvalidCredentialsException || error instanceof UnauthorizedException) {
            log.info("Unauthenticated: {}", error.getMessage());
            return Status.UNAUTHENTICATED.withDescription(error.getMessage()).asRuntimeException();
        }
        if (error instanceof NotFoundException) {
            log.warn("Not found: {}", error.getMessage());
            return Status.NOT_FOUND.withDescription(error.getMessage()).asRuntimeException();
        }
        if (error instanceof ForbiddenException) {
            log.warn("Permission denied");
            return Status.PERMISSION_DENIED.withDescription(error.getMessage()).asRuntimeException();
        }
        log.error("Internal error in gRPC call: {}", error.getMessage(), error);
        return Status.INTERNAL.withDescription(INTERNAL_DESCRIPTION).asRuntimeException();
    }
}
