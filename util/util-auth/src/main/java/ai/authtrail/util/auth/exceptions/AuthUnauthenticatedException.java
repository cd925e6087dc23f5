package ai.authtrail.util.auth.exceptions;

import io.grpc.Status;

public class AuthUnauthenticatedException extends AuthException {

    public AuthUnauthenticatedException(String message) {
        super(message);
    }

    public AuthUnauthenticatedException(String message, String internalDetails) {
        super(message, internalDetails);
    }

    public AuthUnauthenticatedException(Throwable cause, String message) {
        super(cause, message);
    }

    @Override
    public Status status() {
        return Status.UNAUTHENTICATED;
    }
}
