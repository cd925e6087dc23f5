package ai.authtrail.auth.clients;

import ai.authtrail.auth.resources.Subject;
import ai.authtrail.util.auth.exceptions.AuthException;
import ai.authtrail.util.grpc.trailers.HeaderSink;
import io.grpc.Metadata;

/**
 * Decides whether a call may proceed. Whatever the outcome, the implementation may attach response
 * headers (challenges, diagnostics) to {@code responseHeaders}.
 */
public interface Authenticator {

    Subject authenticate(Metadata requestHeaders, HeaderSink responseHeaders) throws AuthException;

    /**
     * Called after {@link #authenticate} rejected the call as unauthenticated, before the call is closed.
     */
    default void challenge(HeaderSink responseHeaders) {
    }

}
