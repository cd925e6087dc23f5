package ai.authtrail.util.grpc;

import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.StatusRuntimeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Closes the call with a mapped status when the service method throws, so that interceptors
 * wrapping the call observe the failure in {@link ServerCall#close}.
 */
public class GrpcExceptionHandlingInterceptor implements ServerInterceptor {

    private static final Logger LOG = LogManager.getLogger("GrpcExceptionHandling");

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call,
                                                                 Metadata headers,
                                                                 ServerCallHandler<ReqT, RespT> next)
    {
        ServerCall.Listener<ReqT> listener = next.startCall(call, headers);
        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(listener) {
            @Override
            public void onMessage(ReqT message) {
                try {
                    super.onMessage(message);
                } catch (Exception e) {
                    handle(call, e);
                }
            }

            @Override
            public void onHalfClose() {
                try {
                    super.onHalfClose();
                } catch (Exception e) {
                    handle(call, e);
                }
            }
        };
    }

    private static void handle(ServerCall<?, ?> call, Exception e) {
        LOG.error("Got unhandled exception in {}", call.getMethodDescriptor().getFullMethodName(), e);
        StatusRuntimeException exception = GrpcUtils.mapToGrpcException(e);
        call.close(exception.getStatus(), Objects.requireNonNullElseGet(exception.getTrailers(), Metadata::new));
    }

    public static GrpcExceptionHandlingInterceptor server() {
        return new GrpcExceptionHandlingInterceptor();
    }
}
