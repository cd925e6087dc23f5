package ai.authtrail.service;

import ai.authtrail.auth.clients.Authenticator;
import ai.authtrail.auth.grpc.interceptors.AuthServerInterceptor;
import ai.authtrail.service.auth.BearerTokenAuthenticator;
import ai.authtrail.util.grpc.trailers.HeaderToTrailerInterceptor;
import io.grpc.reflection.v1alpha.ServerReflectionGrpc;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

@Factory
public class BeanFactory {

    @Singleton
    public Authenticator authenticator() {
        return new BearerTokenAuthenticator();
    }

    @Singleton
    public AuthServerInterceptor authInterceptor(Authenticator authenticator) {
        return new AuthServerInterceptor(authenticator)
            .withUnauthenticated(ServerReflectionGrpc.getServerReflectionInfoMethod());
    }

    @Singleton
    public HeaderToTrailerInterceptor headerToTrailerInterceptor(AppConfig config) {
        return config.getPropagation().createInterceptor();
    }
}
