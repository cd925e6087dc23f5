package ai.authtrail.service;

import ai.authtrail.auth.grpc.interceptors.AuthServerInterceptor;
import ai.authtrail.service.grpc.AuthService;
import ai.authtrail.util.grpc.GrpcExceptionHandlingInterceptor;
import ai.authtrail.util.grpc.GrpcUtils;
import ai.authtrail.util.grpc.trailers.HeaderToTrailerInterceptor;
import com.google.common.net.HostAndPort;
import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.ServerInterceptor;
import io.micronaut.context.ApplicationContext;
import io.micronaut.context.exceptions.NoSuchBeanException;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

@Singleton
public class AuthServiceApp {
    private static final Logger LOG = LogManager.getLogger(AuthServiceApp.class);

    public static final String APP = "AuthService";

    private final Server server;

    public AuthServiceApp(AppConfig config, HeaderToTrailerInterceptor headerToTrailer,
                          AuthServerInterceptor authInterceptor, AuthService authService)
    {
        LOG.info("Starting {} with header propagation {}", APP, headerToTrailer.rule());
        server = createServer(HostAndPort.fromString(config.getAddress()), headerToTrailer, authInterceptor,
            authService);
    }

    /**
     * Interceptors run in order: logs, header-to-trailer, authentication, exception handling.
     */
    public static Server createServer(HostAndPort address, HeaderToTrailerInterceptor headerToTrailer,
                                      AuthServerInterceptor authInterceptor, BindableService authService)
    {
        List<ServerInterceptor> interceptors = List.of(
            headerToTrailer,
            authInterceptor,
            GrpcExceptionHandlingInterceptor.server());

        return GrpcUtils.newGrpcServer(address, interceptors)
            .addService(authService)
            .build();
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        try (ApplicationContext context = ApplicationContext.run()) {
            var app = context.getBean(AuthServiceApp.class);

            app.start();
            app.awaitTermination();
        } catch (NoSuchBeanException e) {
            LOG.fatal(e.getMessage(), e);
            System.exit(-1);
        }
    }

    public void start() throws IOException {
        server.start();
        LOG.info("{} server started on {}", APP,
            server.getListenSockets().stream().map(Object::toString).collect(Collectors.joining()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("gRPC server is shutting down!");
            stop();
        }));
    }

    public void stop() {
        server.shutdown();
    }

    public void awaitTermination() throws InterruptedException {
        server.awaitTermination();
    }
}
