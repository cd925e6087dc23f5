package ai.authtrail.auth.grpc.interceptors;

import ai.authtrail.auth.clients.Authenticator;
import ai.authtrail.auth.grpc.context.AuthenticationContext;
import ai.authtrail.auth.resources.Subject;
import ai.authtrail.logs.LogContextKey;
import ai.authtrail.util.auth.exceptions.AuthException;
import ai.authtrail.util.auth.exceptions.AuthUnauthenticatedException;
import ai.authtrail.util.grpc.trailers.ResponseHeaders;
import com.google.common.collect.ImmutableSet;
import io.grpc.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Arrays;
import java.util.Set;
import java.util.function.Function;

/**
 * Authenticates every call with the given {@link Authenticator}. Headers the authenticator attaches
 * go to {@link ResponseHeaders#current()}, so they reach the client only when
 * {@link ai.authtrail.util.grpc.trailers.HeaderToTrailerInterceptor} wraps this interceptor.
 */
public class AuthServerInterceptor implements ServerInterceptor {
    private static final Logger LOG = LogManager.getLogger(AuthServerInterceptor.class);

    private final Function<AuthException, StatusException> exceptionMapper;
    private final Set<MethodDescriptor<?, ?>> unauthenticatedMethods;
    private final Authenticator authenticator;

    public AuthServerInterceptor(Authenticator authenticator) {
        this(AuthServerInterceptor::defaultExceptionMapper, authenticator);
    }

    public AuthServerInterceptor(Function<AuthException, StatusException> exceptionMapper,
                                 Authenticator authenticator)
    {
        this(exceptionMapper, ImmutableSet.of(), authenticator);
    }

    AuthServerInterceptor(Function<AuthException, StatusException> exceptionMapper,
                          Set<MethodDescriptor<?, ?>> unauthenticatedMethods,
                          Authenticator authenticator)
    {
        this.exceptionMapper = exceptionMapper;
        this.unauthenticatedMethods = unauthenticatedMethods;
        this.authenticator = authenticator;
    }

    private static StatusException defaultExceptionMapper(AuthException e) {
        return e.toStatus().asException(new Metadata());
    }

    public AuthServerInterceptor withUnauthenticated(MethodDescriptor<?, ?>... unauthenticatedMethods) {
        return this.withUnauthenticated(Arrays.asList(unauthenticatedMethods));
    }

    public AuthServerInterceptor withUnauthenticated(Iterable<MethodDescriptor<?, ?>> unauthenticatedMethods) {
        var unauthenticatedMethodSet = ImmutableSet.<MethodDescriptor<?, ?>>builder()
            .addAll(this.unauthenticatedMethods)
            .addAll(unauthenticatedMethods)
            .build();

        return new AuthServerInterceptor(exceptionMapper, unauthenticatedMethodSet, authenticator);
    }

    @Override
    public <T, R> ServerCall.Listener<T> interceptCall(ServerCall<T, R> call, Metadata headers,
                                                       ServerCallHandler<T, R> next)
    {
        if (unauthenticatedMethods.contains(call.getMethodDescriptor())) {
            return next.startCall(call, headers);
        }

        var responseHeaders = ResponseHeaders.current();

        final Subject subject;
        try {
            subject = authenticator.authenticate(headers, responseHeaders);
        } catch (AuthException authException) {
            LOG.warn("Auth error in {}, status: {}, message: {}, internal: {}",
                call.getMethodDescriptor().getFullMethodName(), authException.status().getCode(),
                authException.getMessage(), authException.getInternalDetails());
            if (authException instanceof AuthUnauthenticatedException) {
                authenticator.challenge(responseHeaders);
            }
            return closeCall(call, exceptionMapper.apply(authException));
        }

        LOG.debug("Subject {} authenticated for {}", subject.str(), call.getMethodDescriptor().getFullMethodName());

        Context context = Context.current().withValue(AuthenticationContext.KEY, new AuthenticationContext(subject));
        var serverCall = new GrpcServerCall<>(call, subject.id());
        return Contexts.interceptCall(context, serverCall, headers, next);
    }

    private <T, R> ServerCall.Listener<T> closeCall(ServerCall<T, R> call, StatusException statusException) {
        var trailers = statusException.getTrailers();
        call.close(statusException.getStatus(), trailers == null ? new Metadata() : trailers);
        return new ServerCall.Listener<>() {
        };
    }

    private static class GrpcServerCall<M, R> extends ForwardingServerCall.SimpleForwardingServerCall<M, R> {
        private GrpcServerCall(ServerCall<M, R> serverCall, String subject) {
            super(serverCall);
            ThreadContext.put(LogContextKey.SUBJECT, subject);
        }

        @Override
        public void close(Status status, Metadata trailers) {
            super.close(status, trailers);
            ThreadContext.remove(LogContextKey.SUBJECT);
        }
    }
}
