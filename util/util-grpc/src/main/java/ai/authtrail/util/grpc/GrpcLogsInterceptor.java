package ai.authtrail.util.grpc;

import ai.authtrail.logs.LogContextKey;
import ai.authtrail.logs.LogUtils;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.TextFormat;
import io.grpc.*;
import io.grpc.ForwardingServerCallListener.SimpleForwardingServerCallListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.UUID;

public class GrpcLogsInterceptor {
    private static final Logger SERVER_LOG = LogManager.getLogger("GrpcServer");
    private static final Logger CLIENT_LOG = LogManager.getLogger("GrpcClient");

    public static ServerInterceptor server() {
        return new ServerInterceptor() {
            @Override
            public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call, Metadata headers,
                                                                         ServerCallHandler<ReqT, RespT> next)
            {
                var callId = UUID.randomUUID().toString();
                var methodName = call.getMethodDescriptor().getFullMethodName();
                var logContext = LogUtils.callContext(methodName, callId);
                logContext.put(LogContextKey.REQUEST_ID,
                    GrpcHeaders.getHeaderOrDefault(headers, GrpcHeaders.X_REQUEST_ID, callId));

                var grpcServerCall = new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
                    @Override
                    public void sendMessage(RespT message) {
                        if (SERVER_LOG.isTraceEnabled()) {
                            SERVER_LOG.trace("{}::<{}>: response: ({})", methodName, callId, printMessage(message));
                        } else {
                            SERVER_LOG.debug("{}::<{}>: response: <...>", methodName, callId);
                        }
                        super.sendMessage(message);
                    }

                    @Override
                    public void close(Status status, Metadata trailers) {
                        super.close(status, trailers);
                        SERVER_LOG.debug("{}::<{}>: closed with {}, trailers: {}",
                            methodName, callId, status.getCode(), trailers.keys());
                    }
                };

                var listener = LogUtils.withLoggingContext(logContext, () -> next.startCall(grpcServerCall, headers));

                return new SimpleForwardingServerCallListener<>(listener) {
                    @Override
                    public void onMessage(ReqT message) {
                        LogUtils.withLoggingContext(logContext, () -> {
                            if (SERVER_LOG.isTraceEnabled()) {
                                SERVER_LOG.trace("{}::<{}>, request: ({})", methodName, callId, printMessage(message));
                            } else {
                                SERVER_LOG.debug("{}::<{}>, request: <...>", methodName, callId);
                            }
                            super.onMessage(message);
                        });
                    }

                    @Override
                    public void onHalfClose() {
                        LogUtils.withLoggingContext(logContext, super::onHalfClose);
                    }

                    @Override
                    public void onCancel() {
                        SERVER_LOG.debug("{}::<{}>: cancelled by client", methodName, callId);
                        LogUtils.withLoggingContext(logContext, super::onCancel);
                    }
                };
            }
        };
    }

    public static ClientInterceptor client(String name) {
        return new ClientInterceptor() {
            @Override
            public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(MethodDescriptor<ReqT, RespT> method,
                                                                       CallOptions callOptions, Channel next)
            {
                var methodName = method.getFullMethodName();
                return new ForwardingClientCall.SimpleForwardingClientCall<>(next.newCall(method, callOptions)) {
                    @Override
                    public void start(Listener<RespT> responseListener, Metadata headers) {
                        super.start(new ForwardingClientCallListener.SimpleForwardingClientCallListener<>(
                            responseListener)
                        {
                            @Override
                            public void onClose(Status status, Metadata trailers) {
                                CLIENT_LOG.debug("{} call {} closed with {}, trailers: {}",
                                    name, methodName, status.getCode(), trailers.keys());
                                super.onClose(status, trailers);
                            }
                        }, headers);
                    }

                    @Override
                    public void sendMessage(ReqT message) {
                        if (CLIENT_LOG.isTraceEnabled()) {
                            CLIENT_LOG.trace("{} call {}, request ({})", name, methodName, printMessage(message));
                        } else {
                            CLIENT_LOG.debug("{} call {}, request <...>", name, methodName);
                        }
                        super.sendMessage(message);
                    }
                };
            }
        };
    }

    private static String printMessage(Object message) {
        return message instanceof MessageOrBuilder msg
            ? TextFormat.shortDebugString(msg)
            : message.getClass().getName();
    }
}
