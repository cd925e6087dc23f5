package ai.authtrail.service.auth;

import ai.authtrail.auth.clients.Authenticator;
import ai.authtrail.auth.resources.Subject;
import ai.authtrail.auth.utils.TokenParser;
import ai.authtrail.util.auth.exceptions.AuthUnauthenticatedException;
import ai.authtrail.util.grpc.GrpcHeaders;
import ai.authtrail.util.grpc.trailers.HeaderSink;
import io.grpc.Metadata;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

import static ai.authtrail.util.grpc.trailers.HeaderToTrailerInterceptor.WWW_AUTHENTICATE;
import static ai.authtrail.util.grpc.trailers.HeaderToTrailerInterceptor.X_CUSTOM_TEST;

/**
 * Demo authenticator: every bearer token starting with {@code valid-} belongs to the test user.
 * The outcome is reported to the client with the {@code x-custom-test} response header.
 */
public class BearerTokenAuthenticator implements Authenticator {
    private static final Logger LOG = LogManager.getLogger(BearerTokenAuthenticator.class);

    public static final String REALM = "GrpcService";
    public static final String VALID_TOKEN_PREFIX = "valid-";

    public static final Subject TEST_USER = new Subject("123", "testuser");

    @Override
    public Subject authenticate(Metadata requestHeaders, HeaderSink responseHeaders)
        throws AuthUnauthenticatedException
    {
        var authorization = GrpcHeaders.getHeader(requestHeaders, GrpcHeaders.AUTHORIZATION);
        if (authorization == null) {
            responseHeaders.attach(X_CUSTOM_TEST, "authentication-failed");
            responseHeaders.attach(WWW_AUTHENTICATE, "Bearer realm=\"%s\"".formatted(REALM));
            throw new AuthUnauthenticatedException("Missing Authorization header");
        }

        final String token;
        try {
            token = TokenParser.parse(authorization).token();
        } catch (IllegalArgumentException e) {
            rejectToken(responseHeaders);
            throw new AuthUnauthenticatedException("Invalid token", e.getMessage());
        }

        if (!token.toLowerCase(Locale.ROOT).startsWith(VALID_TOKEN_PREFIX)) {
            rejectToken(responseHeaders);
            throw new AuthUnauthenticatedException("Invalid token");
        }

        LOG.debug("Token accepted for {}", TEST_USER.str());
        responseHeaders.attach(X_CUSTOM_TEST, "authentication-success");
        return TEST_USER;
    }

    /**
     * Appends to the headers set by {@link #authenticate}, so {@code x-custom-test} carries both the
     * rejection reason and the challenge marker.
     */
    @Override
    public void challenge(HeaderSink responseHeaders) {
        responseHeaders.attach(X_CUSTOM_TEST, "challenge-initiated");
    }

    private static void rejectToken(HeaderSink responseHeaders) {
        responseHeaders.attach(X_CUSTOM_TEST, "invalid-token");
        responseHeaders.attach(WWW_AUTHENTICATE, "Bearer realm=\"%s\", error=\"invalid_token\"".formatted(REALM));
    }
}
