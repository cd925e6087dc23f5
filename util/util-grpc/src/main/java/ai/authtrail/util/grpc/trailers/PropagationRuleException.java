package ai.authtrail.util.grpc.trailers;

/**
 * Thrown when a {@link PropagationRule} cannot be honoured, e.g. it explicitly asks to copy a key
 * owned by the transport.
 */
public class PropagationRuleException extends IllegalArgumentException {

    public PropagationRuleException(String message) {
        super(message);
    }
}
