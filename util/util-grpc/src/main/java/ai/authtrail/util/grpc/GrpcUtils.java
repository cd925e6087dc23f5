package ai.authtrail.util.grpc;

import com.google.common.net.HostAndPort;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.ProtoReflectionService;
import io.grpc.stub.AbstractBlockingStub;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.TimeUnit;

public final class GrpcUtils {
    public static final long KEEP_ALIVE_TIME_MINS_ALLOWED = 1;

    private GrpcUtils() {
    }

    public static <T extends AbstractBlockingStub<T>> T newBlockingClient(T stub, String name) {
        return stub.withInterceptors(GrpcLogsInterceptor.client(name));
    }

    public static ManagedChannel newGrpcChannel(HostAndPort address) {
        return ManagedChannelBuilder.forAddress(address.getHost(), address.getPort())
            .usePlaintext()
            .build();
    }

    public static ManagedChannel newGrpcChannel(String address) {
        return newGrpcChannel(HostAndPort.fromString(address));
    }

    public static NettyServerBuilder addKeepAlive(NettyServerBuilder builder) {
        return builder
            .permitKeepAliveWithoutCalls(true)
            .permitKeepAliveTime(KEEP_ALIVE_TIME_MINS_ALLOWED, TimeUnit.MINUTES);
    }

    public static NettyServerBuilder addReflection(NettyServerBuilder builder) {
        return builder
            .addService(ProtoReflectionService.newInstance());
    }

    /**
     * Installs server logs as the outermost interceptor, then {@code interceptors} in the given order.
     */
    public static NettyServerBuilder intercept(NettyServerBuilder builder, List<ServerInterceptor> interceptors) {
        for (int i = interceptors.size() - 1; i >= 0; --i) {
            builder.intercept(interceptors.get(i));
        }
        return builder.intercept(GrpcLogsInterceptor.server());
    }

    public static NettyServerBuilder newGrpcServer(HostAndPort address, List<ServerInterceptor> interceptors) {
        return intercept(
            addReflection(
                addKeepAlive(
                    NettyServerBuilder.forAddress(new InetSocketAddress(address.getHost(), address.getPort())))),
            interceptors);
    }

    public static StatusRuntimeException mapToGrpcException(Exception e) {
        if (e instanceof StatusRuntimeException statusRuntimeException) {
            return statusRuntimeException;
        }
        if (e instanceof StatusException statusException) {
            return new StatusRuntimeException(statusException.getStatus(), statusException.getTrailers());
        }
        if (e instanceof IllegalArgumentException) {
            return Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException();
        }
        if (e instanceof IllegalStateException) {
            return Status.FAILED_PRECONDITION.withDescription(e.getMessage()).asRuntimeException();
        }
        if (e instanceof UnsupportedOperationException) {
            return Status.UNIMPLEMENTED.withDescription(e.getMessage()).asRuntimeException();
        }
        if (e instanceof RuntimeException) {
            return Status.INTERNAL.withDescription(e.getMessage()).asRuntimeException();
        }
        return Status.UNKNOWN.withDescription(e.getMessage()).asRuntimeException();
    }
}
