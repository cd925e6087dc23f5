package ai.authtrail.util.grpc.trailers;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Copies response headers attached during a call (see {@link ResponseHeaders}) into the trailing
 * metadata of that call.
 *
 * <p>Must be registered outside of every interceptor that attaches headers, i.e. added to the
 * server builder <b>after</b> the authentication interceptor. The merge happens inside
 * {@link ServerCall#close}, so it also covers calls rejected before the service method runs.
 * Statuses are never changed; a header the transport refuses is skipped.
 */
public class HeaderToTrailerInterceptor implements ServerInterceptor {
    private static final Logger LOG = LogManager.getLogger(HeaderToTrailerInterceptor.class);

    public static final String WWW_AUTHENTICATE = "www-authenticate";
    public static final String X_CUSTOM_TEST = "x-custom-test";

    private final PropagationRule rule;
    private final boolean mirrorToHeaders;

    public HeaderToTrailerInterceptor(PropagationRule rule) {
        this(rule, false);
    }

    private HeaderToTrailerInterceptor(PropagationRule rule, boolean mirrorToHeaders) {
        this.rule = Objects.requireNonNull(rule, "rule is null");
        this.rule.validate();
        this.mirrorToHeaders = mirrorToHeaders;
    }

    /**
     * Interceptor copying only {@code headersToCapture}, or the authentication challenge headers
     * if nothing is given.
     */
    public static HeaderToTrailerInterceptor create(String... headersToCapture) {
        if (headersToCapture == null || headersToCapture.length == 0) {
            return new HeaderToTrailerInterceptor(PropagationRule.allowOnly(WWW_AUTHENTICATE, X_CUSTOM_TEST));
        }
        return new HeaderToTrailerInterceptor(PropagationRule.allowOnly(headersToCapture));
    }

    /**
     * Same rule, but eligible headers captured before the response headers go out are also sent
     * in the header frame.
     */
    public HeaderToTrailerInterceptor mirroringToHeaders() {
        return new HeaderToTrailerInterceptor(rule, true);
    }

    public PropagationRule rule() {
        return rule;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call, Metadata headers,
                                                                 ServerCallHandler<ReqT, RespT> next)
    {
        var callContext = new CallContext(rule);
        var context = Context.current().withValue(ResponseHeaders.KEY, callContext.headers());
        var trailersCall = new TrailerPropagatingServerCall<>(call, callContext, mirrorToHeaders);

        callContext.handlerStarted();

        final ServerCall.Listener<ReqT> listener;
        try {
            listener = Contexts.interceptCall(context, trailersCall, headers, next);
        } catch (RuntimeException e) {
            closeOnFault(trailersCall, Status.fromThrowable(e), e);
            return new ServerCall.Listener<>() {};
        }

        return new FaultHandlingListener<>(listener, trailersCall, callContext);
    }

    /**
     * Closes the call the way the server transport would: {@code startCall} faults keep the status
     * carried by the exception, listener faults always end as {@code UNKNOWN}.
     */
    private static <ReqT, RespT> void closeOnFault(TrailerPropagatingServerCall<ReqT, RespT> call, Status status,
                                                   RuntimeException e)
    {
        var trailers = Status.trailersFromThrowable(e);

        LOG.debug("Call {} failed with unhandled exception, closing with status {}",
            call.getMethodDescriptor().getFullMethodName(), status.getCode());
        try {
            call.close(status, trailers == null ? new Metadata() : trailers);
        } catch (IllegalStateException closeError) {
            LOG.debug("Cannot attach captured headers to faulted call {}: {}",
                call.getMethodDescriptor().getFullMethodName(), closeError.getMessage());
            throw e;
        }
    }

    private static final class TrailerPropagatingServerCall<ReqT, RespT>
        extends ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>
    {
        private final CallContext callContext;
        private final boolean mirrorToHeaders;

        private TrailerPropagatingServerCall(ServerCall<ReqT, RespT> delegate, CallContext callContext,
                                             boolean mirrorToHeaders)
        {
            super(delegate);
            this.callContext = callContext;
            this.mirrorToHeaders = mirrorToHeaders;
        }

        @Override
        public void sendHeaders(Metadata headers) {
            if (mirrorToHeaders) {
                callContext.copyInto(headers, "headers");
            }
            super.sendHeaders(headers);
        }

        @Override
        public void close(Status status, Metadata trailers) {
            if (!callContext.finish(status)) {
                LOG.debug("Call {} is already {}, trailers are sent as is",
                    getMethodDescriptor().getFullMethodName(), callContext.phase());
                super.close(status, trailers);
                return;
            }

            try {
                callContext.mergeInto(trailers);
            } catch (RuntimeException e) {
                LOG.warn("Cannot propagate headers of call {} to trailers: {}",
                    getMethodDescriptor().getFullMethodName(), e.getMessage());
            }

            super.close(status, trailers);
            callContext.markSent();
        }
    }

    private static final class FaultHandlingListener<ReqT, RespT>
        extends ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>
    {
        private final TrailerPropagatingServerCall<ReqT, RespT> call;
        private final CallContext callContext;

        private FaultHandlingListener(ServerCall.Listener<ReqT> delegate, TrailerPropagatingServerCall<ReqT, RespT> call,
                                      CallContext callContext)
        {
            super(delegate);
            this.call = call;
            this.callContext = callContext;
        }

        @Override
        public void onMessage(ReqT message) {
            try {
                super.onMessage(message);
            } catch (RuntimeException e) {
                closeOnFault(call, Status.UNKNOWN.withCause(e), e);
            }
        }

        @Override
        public void onHalfClose() {
            try {
                super.onHalfClose();
            } catch (RuntimeException e) {
                closeOnFault(call, Status.UNKNOWN.withCause(e), e);
            }
        }

        @Override
        public void onReady() {
            try {
                super.onReady();
            } catch (RuntimeException e) {
                closeOnFault(call, Status.UNKNOWN.withCause(e), e);
            }
        }

        @Override
        public void onCancel() {
            if (callContext.cancel()) {
                LOG.debug("Call {} cancelled, captured headers are discarded",
                    call.getMethodDescriptor().getFullMethodName());
            }
            super.onCancel();
        }
    }
}
