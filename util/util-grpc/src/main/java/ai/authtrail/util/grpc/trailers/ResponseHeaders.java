package ai.authtrail.util.grpc.trailers;

import io.grpc.Context;

/**
 * Access to the response header sink of the call bound to the current gRPC {@link Context}.
 * Without {@link HeaderToTrailerInterceptor} in the chain every attached header is dropped.
 */
public final class ResponseHeaders {
    static final Context.Key<HeaderSink> KEY = Context.key("response-headers");

    private ResponseHeaders() { }

    public static HeaderSink current() {
        var sink = KEY.get();
        return sink == null ? HeaderSink.NOOP : sink;
    }

    public static void attach(String key, String value) {
        current().attach(key, value);
    }
}
