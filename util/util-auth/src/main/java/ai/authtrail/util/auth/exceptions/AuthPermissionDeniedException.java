package ai.authtrail.util.auth.exceptions;

import io.grpc.Status;

public class AuthPermissionDeniedException extends AuthException {

    public AuthPermissionDeniedException(String message) {
        super(message);
    }

    public AuthPermissionDeniedException(String message, String internalDetails) {
        super(message, internalDetails);
    }

    public AuthPermissionDeniedException(Throwable cause, String message) {
        super(cause, message);
    }

    @Override
    public Status status() {
        return Status.PERMISSION_DENIED;
    }
}
