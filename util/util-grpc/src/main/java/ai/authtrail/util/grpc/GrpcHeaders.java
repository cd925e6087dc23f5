package ai.authtrail.util.grpc;

import io.grpc.Metadata;
import jakarta.annotation.Nullable;

import java.util.Objects;
import java.util.Optional;

public final class GrpcHeaders {
    public static final Metadata.Key<String> AUTHORIZATION = createMetadataKey("Authorization");
    public static final Metadata.Key<String> X_REQUEST_ID = createMetadataKey("X-Request-ID");
    public static final Metadata.Key<String> WWW_AUTHENTICATE = createMetadataKey("WWW-Authenticate");

    private GrpcHeaders() { }

    @Nullable
    public static <T> T getHeader(@Nullable Metadata headers, Metadata.Key<T> key) {
        return headers == null ? null : headers.get(key);
    }

    @Nullable
    public static String getHeader(@Nullable Metadata headers, String headerName) {
        return getHeader(headers, createMetadataKey(headerName));
    }

    public static <T> T getHeaderOrDefault(@Nullable Metadata headers, Metadata.Key<T> key, T defaultValue) {
        Objects.requireNonNull(defaultValue);
        return Optional.ofNullable(headers).map(m -> m.get(key)).orElse(defaultValue);
    }

    public static Metadata.Key<String> createMetadataKey(String headerName) {
        return Metadata.Key.of(headerName, Metadata.ASCII_STRING_MARSHALLER);
    }
}
