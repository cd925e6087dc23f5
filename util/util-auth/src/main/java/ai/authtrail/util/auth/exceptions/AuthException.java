package ai.authtrail.util.auth.exceptions;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;

public abstract class AuthException extends RuntimeException {
    private final String internalDetails;

    public AuthException(String message) {
        this(message, null);
    }

    public AuthException(String message, String internalDetails) {
        super(message);
        this.internalDetails = internalDetails;
    }

    public AuthException(Throwable cause, String message) {
        super(message, cause);
        this.internalDetails = cause.getMessage();
    }

    @Override
    public Throwable fillInStackTrace() {
        return this;
    }

    public String getInternalDetails() {
        return this.internalDetails;
    }

    public abstract Status status();

    public Status toStatus() {
        return status().withDescription(getMessage());
    }

    public StatusRuntimeException toStatusRuntimeException() {
        return toStatus().asRuntimeException();
    }
}
