package ai.authtrail.util.grpc;

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.function.Supplier;

/**
 * Puts request headers on every outgoing call. Values are resolved per call, a {@code null}
 * value leaves the header out.
 */
public final class ClientHeaderInterceptor implements ClientInterceptor {
    private static final Logger LOG = LogManager.getLogger(ClientHeaderInterceptor.class);

    private record HeaderValue(Metadata.Key<String> key, Supplier<String> value) {}

    private final List<HeaderValue> headers;

    private ClientHeaderInterceptor(List<HeaderValue> headers) {
        this.headers = headers;
    }

    public static ClientHeaderInterceptor authorization(Supplier<String> token) {
        return header(GrpcHeaders.AUTHORIZATION, () -> {
            var value = token.get();
            return value == null ? null : "Bearer " + value;
        });
    }

    public static ClientHeaderInterceptor requestId(Supplier<String> requestId) {
        return header(GrpcHeaders.X_REQUEST_ID, requestId);
    }

    public static ClientHeaderInterceptor header(Metadata.Key<String> key, Supplier<String> value) {
        return new ClientHeaderInterceptor(List.of(new HeaderValue(key, value)));
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(MethodDescriptor<ReqT, RespT> method,
                                                               CallOptions callOptions, Channel next)
    {
        return new ForwardingClientCall.SimpleForwardingClientCall<>(next.newCall(method, callOptions)) {
            @Override
            public void start(Listener<RespT> responseListener, Metadata requestHeaders) {
                for (var header : headers) {
                    var value = header.value().get();
                    if (value == null) {
                        LOG.trace("No value for header {}, skip", header.key().name());
                        continue;
                    }
                    requestHeaders.put(header.key(), value);
                }
                super.start(responseListener, requestHeaders);
            }
        };
    }
}
