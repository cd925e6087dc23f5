package ai.authtrail.util.auth.exceptions;

import io.grpc.Status;

public class AuthInternalException extends AuthException {

    public AuthInternalException(String message) {
        super(message);
    }

    public AuthInternalException(String message, String internalDetails) {
        super(message, internalDetails);
    }

    public AuthInternalException(Throwable cause, String message) {
        super(cause, message);
    }

    @Override
    public Status status() {
        return Status.INTERNAL;
    }
}
