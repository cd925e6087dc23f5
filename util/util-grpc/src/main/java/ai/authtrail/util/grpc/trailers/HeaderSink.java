package ai.authtrail.util.grpc.trailers;

/**
 * Write-only view of the response headers of the current call.
 * Handlers that run before the call status is known (authentication, validation) attach their
 * headers here and never deal with trailers directly.
 */
@FunctionalInterface
public interface HeaderSink {

    HeaderSink NOOP = (key, value) -> { };

    /**
     * Attaches one more value for {@code key}. Existing values for the same key are kept.
     */
    void attach(String key, String value);
}
