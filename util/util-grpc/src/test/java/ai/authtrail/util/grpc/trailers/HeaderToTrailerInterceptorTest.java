package ai.authtrail.util.grpc.trailers;

import ai.authtrail.util.grpc.trailers.TestCalls.RecordingServerCall;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ClientInterceptors;
import io.grpc.ForwardingClientCall;
import io.grpc.ForwardingClientCallListener;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.ClientCalls;
import io.grpc.testing.GrpcCleanupRule;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static ai.authtrail.util.grpc.trailers.TestCalls.ECHO;
import static ai.authtrail.util.grpc.trailers.TestCalls.REPEAT;
import static ai.authtrail.util.grpc.trailers.TestCalls.WWW_AUTHENTICATE;
import static ai.authtrail.util.grpc.trailers.TestCalls.X_CUSTOM_TEST;
import static ai.authtrail.util.grpc.trailers.TestCalls.values;

public class HeaderToTrailerInterceptorTest {

    @Rule
    public final GrpcCleanupRule grpcCleanup = new GrpcCleanupRule();

    private static final Metadata.Key<String> AUTHORIZATION =
        Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);
    private static final Metadata.Key<String> X_REQUEST =
        Metadata.Key.of("x-request", Metadata.ASCII_STRING_MARSHALLER);

    /**
     * Rejects calls without the authorization header after attaching {@code challenge}.
     */
    private static ServerInterceptor rejectingAuth(Map<String, String> challenge) {
        return new ServerInterceptor() {
            @Override
            public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call,
                                                                         Metadata headers,
                                                                         ServerCallHandler<ReqT, RespT> next)
            {
                if (headers.get(AUTHORIZATION) != null) {
                    return next.startCall(call, headers);
                }
                challenge.forEach(ResponseHeaders::attach);
                call.close(Status.UNAUTHENTICATED.withDescription("Missing Authorization header"), new Metadata());
                return new ServerCall.Listener<>() {};
            }
        };
    }

    private static final class TrailersCapture implements ClientInterceptor {
        final AtomicReference<Metadata> headers = new AtomicReference<>();
        final AtomicReference<Metadata> trailers = new AtomicReference<>();

        @Override
        public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(MethodDescriptor<ReqT, RespT> method,
                                                                   CallOptions callOptions, Channel next)
        {
            return new ForwardingClientCall.SimpleForwardingClientCall<>(next.newCall(method, callOptions)) {
                @Override
                public void start(Listener<RespT> listener, Metadata requestHeaders) {
                    super.start(new ForwardingClientCallListener.SimpleForwardingClientCallListener<>(listener) {
                        @Override
                        public void onHeaders(Metadata responseHeaders) {
                            headers.set(responseHeaders);
                            super.onHeaders(responseHeaders);
                        }

                        @Override
                        public void onClose(Status status, Metadata responseTrailers) {
                            trailers.set(responseTrailers);
                            super.onClose(status, responseTrailers);
                        }
                    }, requestHeaders);
                }
            };
        }
    }

    private ManagedChannel start(ServerServiceDefinition service, boolean directExecutor) throws Exception {
        var name = InProcessServerBuilder.generateName();
        var serverBuilder = InProcessServerBuilder.forName(name).addService(service);
        var channelBuilder = InProcessChannelBuilder.forName(name);
        if (directExecutor) {
            serverBuilder.directExecutor();
            channelBuilder.directExecutor();
        }
        grpcCleanup.register(serverBuilder.build().start());
        return grpcCleanup.register(channelBuilder.build());
    }

    private ManagedChannel start(ServerServiceDefinition service) throws Exception {
        return start(service, true);
    }

    private static StatusRuntimeException callFailing(Channel channel) {
        return callFailing(channel, "hello");
    }

    private static StatusRuntimeException callFailing(Channel channel, String request) {
        return Assert.assertThrows(StatusRuntimeException.class,
            () -> ClientCalls.blockingUnaryCall(channel, ECHO, CallOptions.DEFAULT, request));
    }

    @Test
    public void rejectedCallCarriesChallengeInTrailers() throws Exception {
        var service = ServerInterceptors.intercept(
            TestCalls.service((request, observer) -> Assert.fail("must not be called")),
            rejectingAuth(Map.of("www-authenticate", "Bearer realm=api", "x-custom-test", "1")),
            new HeaderToTrailerInterceptor(PropagationRule.copyAll()));

        var e = callFailing(start(service));

        Assert.assertEquals(Status.Code.UNAUTHENTICATED, e.getStatus().getCode());
        Assert.assertEquals("Missing Authorization header", e.getStatus().getDescription());
        Assert.assertEquals(List.of("Bearer realm=api"), values(e.getTrailers(), WWW_AUTHENTICATE));
        Assert.assertEquals(List.of("1"), values(e.getTrailers(), X_CUSTOM_TEST));
    }

    @Test
    public void deniedHeaderNeverReachesClient() throws Exception {
        var service = ServerInterceptors.intercept(
            TestCalls.service((request, observer) -> Assert.fail("must not be called")),
            rejectingAuth(Map.of("www-authenticate", "Bearer realm=api", "x-custom-test", "1")),
            new HeaderToTrailerInterceptor(PropagationRule.denyAll("X-Custom-Test")));

        var e = callFailing(start(service));

        Assert.assertEquals(List.of("Bearer realm=api"), values(e.getTrailers(), WWW_AUTHENTICATE));
        Assert.assertFalse(e.getTrailers().containsKey(X_CUSTOM_TEST));
    }

    @Test
    public void allowListCopiesOnlyListedHeaders() throws Exception {
        var service = ServerInterceptors.intercept(
            TestCalls.service((request, observer) -> Assert.fail("must not be called")),
            rejectingAuth(Map.of("www-authenticate", "Bearer realm=api", "x-custom-test", "1")),
            HeaderToTrailerInterceptor.create("WWW-Authenticate"));

        var e = callFailing(start(service));

        Assert.assertEquals(List.of("Bearer realm=api"), values(e.getTrailers(), WWW_AUTHENTICATE));
        Assert.assertFalse(e.getTrailers().containsKey(X_CUSTOM_TEST));
    }

    @Test
    public void withoutInterceptorHeadersAreLost() throws Exception {
        var service = ServerInterceptors.intercept(
            TestCalls.service((request, observer) -> Assert.fail("must not be called")),
            rejectingAuth(Map.of("www-authenticate", "Bearer realm=api")));

        var e = callFailing(start(service));

        Assert.assertEquals(Status.Code.UNAUTHENTICATED, e.getStatus().getCode());
        Assert.assertFalse(e.getTrailers().containsKey(WWW_AUTHENTICATE));
    }

    @Test
    public void handlerTrailersGoBeforePropagatedHeaders() throws Exception {
        var service = ServerInterceptors.intercept(
            TestCalls.service((request, observer) -> {
                ResponseHeaders.attach("WWW-Authenticate", "Bearer realm=api");
                var trailers = new Metadata();
                trailers.put(WWW_AUTHENTICATE, "Basic realm=api");
                observer.onError(Status.PERMISSION_DENIED.withDescription("denied").asRuntimeException(trailers));
            }),
            new HeaderToTrailerInterceptor(PropagationRule.copyAll()));

        var e = callFailing(start(service));

        Assert.assertEquals(Status.Code.PERMISSION_DENIED, e.getStatus().getCode());
        Assert.assertEquals("denied", e.getStatus().getDescription());
        Assert.assertEquals(List.of("Basic realm=api", "Bearer realm=api"), values(e.getTrailers(), WWW_AUTHENTICATE));
    }

    @Test
    public void successfulCallGetsPayloadAndAttachedHeaders() throws Exception {
        var service = ServerInterceptors.intercept(
            TestCalls.service((request, observer) -> {
                ResponseHeaders.attach("x-custom-test", "authentication-success");
                observer.onNext("echo " + request);
                observer.onCompleted();
            }),
            rejectingAuth(Map.of("www-authenticate", "Bearer realm=api")),
            new HeaderToTrailerInterceptor(PropagationRule.copyAll()));

        var capture = new TrailersCapture();
        var channel = ClientInterceptors.intercept(start(service), capture);

        var response = ClientCalls.blockingUnaryCall(
            ClientInterceptors.intercept(channel, new ForwardingAuthorization()), ECHO, CallOptions.DEFAULT, "hello");

        Assert.assertEquals("echo hello", response);
        Assert.assertEquals(List.of("authentication-success"), values(capture.trailers.get(), X_CUSTOM_TEST));
        Assert.assertFalse(capture.trailers.get().containsKey(WWW_AUTHENTICATE));
    }

    @Test
    public void handlerFaultStillCarriesHeaders() throws Exception {
        var service = ServerInterceptors.intercept(
            TestCalls.service((request, observer) -> {
                ResponseHeaders.attach("x-custom-test", "before-fault");
                throw new IllegalStateException("boom");
            }),
            new HeaderToTrailerInterceptor(PropagationRule.copyAll()));

        var e = callFailing(start(service));

        Assert.assertEquals(Status.Code.UNKNOWN, e.getStatus().getCode());
        Assert.assertEquals(List.of("before-fault"), values(e.getTrailers(), X_CUSTOM_TEST));
    }

    @Test
    public void handlerStatusExceptionEndsAsWithoutInterceptor() throws Exception {
        var handler = TestCalls.service((request, observer) -> {
            ResponseHeaders.attach("x-custom-test", "before-fault");
            throw Status.PERMISSION_DENIED.withDescription("nope").asRuntimeException();
        });

        var plain = callFailing(start(handler));
        var intercepted = callFailing(start(ServerInterceptors.intercept(handler,
            new HeaderToTrailerInterceptor(PropagationRule.copyAll()))));

        Assert.assertEquals(Status.Code.UNKNOWN, plain.getStatus().getCode());
        Assert.assertEquals(plain.getStatus().getCode(), intercepted.getStatus().getCode());
        Assert.assertEquals(plain.getStatus().getDescription(), intercepted.getStatus().getDescription());
        Assert.assertEquals(List.of("before-fault"), values(intercepted.getTrailers(), X_CUSTOM_TEST));
    }

    @Test
    public void interceptorFaultKeepsItsStatus() throws Exception {
        var throwingAuth = new ServerInterceptor() {
            @Override
            public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call,
                                                                         Metadata headers,
                                                                         ServerCallHandler<ReqT, RespT> next)
            {
                ResponseHeaders.attach("www-authenticate", "Bearer realm=api");
                throw Status.UNAUTHENTICATED.withDescription("token expired").asRuntimeException();
            }
        };
        var service = ServerInterceptors.intercept(
            TestCalls.service((request, observer) -> Assert.fail("must not be called")),
            throwingAuth,
            new HeaderToTrailerInterceptor(PropagationRule.copyAll()));

        var e = callFailing(start(service));

        Assert.assertEquals(Status.Code.UNAUTHENTICATED, e.getStatus().getCode());
        Assert.assertEquals("token expired", e.getStatus().getDescription());
        Assert.assertEquals(List.of("Bearer realm=api"), values(e.getTrailers(), WWW_AUTHENTICATE));
    }

    @Test
    public void streamingCallGetsTrailersAndMirroredHeaders() throws Exception {
        var service = ServerInterceptors.intercept(
            TestCalls.service((request, observer) -> Assert.fail("must not be called")),
            new HeaderToTrailerInterceptor(PropagationRule.allowOnly("x-repeat")).mirroringToHeaders());

        var capture = new TrailersCapture();
        var channel = ClientInterceptors.intercept(start(service), capture);

        var responses = new ArrayList<String>();
        ClientCalls.blockingServerStreamingCall(channel, REPEAT, CallOptions.DEFAULT, "r")
            .forEachRemaining(responses::add);

        var xRepeat = Metadata.Key.of("x-repeat", Metadata.ASCII_STRING_MARSHALLER);
        Assert.assertEquals(List.of("r0", "r1", "r2"), responses);
        Assert.assertEquals(List.of("r"), values(capture.headers.get(), xRepeat));
        Assert.assertEquals(List.of("r"), values(capture.trailers.get(), xRepeat));
    }

    @Test
    public void concurrentCallsDoNotShareHeaders() throws Exception {
        var service = ServerInterceptors.intercept(
            TestCalls.service((request, observer) -> {
                ResponseHeaders.attach("x-request", request);
                observer.onError(Status.FAILED_PRECONDITION.asRuntimeException());
            }),
            new HeaderToTrailerInterceptor(PropagationRule.copyAll()));
        var channel = start(service, false);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            var futures = new ArrayList<Future<List<String>>>();
            for (int i = 0; i < 32; ++i) {
                var request = "request-" + i;
                futures.add(executor.submit((Callable<List<String>>) () -> {
                    var e = callFailing(channel, request);
                    return values(e.getTrailers(), X_REQUEST);
                }));
            }

            for (int i = 0; i < futures.size(); ++i) {
                Assert.assertEquals(List.of("request-" + i), futures.get(i).get(30, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void cancelledCallPropagatesNothing() {
        var interceptor = new HeaderToTrailerInterceptor(PropagationRule.copyAll());
        var call = new RecordingServerCall();
        var wrapped = new AtomicReference<ServerCall<String, String>>();

        ServerCall.Listener<String> listener = interceptor.interceptCall(call, new Metadata(), (serverCall, h) -> {
            ResponseHeaders.attach("x-custom-test", "1");
            wrapped.set(serverCall);
            return new ServerCall.Listener<>() {};
        });

        listener.onCancel();
        wrapped.get().close(Status.CANCELLED, new Metadata());

        Assert.assertEquals(Status.Code.CANCELLED, call.closedStatus.getCode());
        Assert.assertFalse(call.closedTrailers.containsKey(X_CUSTOM_TEST));
    }

    @Test
    public void secondCloseDoesNotDuplicateHeaders() {
        var interceptor = new HeaderToTrailerInterceptor(PropagationRule.copyAll());
        var call = new RecordingServerCall();
        var wrapped = new AtomicReference<ServerCall<String, String>>();

        interceptor.interceptCall(call, new Metadata(), (serverCall, h) -> {
            ResponseHeaders.attach("x-custom-test", "1");
            wrapped.set(serverCall);
            return new ServerCall.Listener<>() {};
        });

        var trailers = new Metadata();
        wrapped.get().close(Status.UNAUTHENTICATED, trailers);
        Assert.assertThrows(IllegalStateException.class, () -> wrapped.get().close(Status.UNAUTHENTICATED, trailers));

        Assert.assertEquals(List.of("1"), values(call.closedTrailers, X_CUSTOM_TEST));
    }

    @Test
    public void reservedKeyInAllowListFailsConstruction() {
        Assert.assertThrows(PropagationRuleException.class,
            () -> new HeaderToTrailerInterceptor(PropagationRule.allowOnly("www-authenticate", "grpc-message")));
        Assert.assertThrows(PropagationRuleException.class, () -> HeaderToTrailerInterceptor.create(":status"));
    }

    @Test
    public void createWithoutArgumentsCopiesChallengeHeaders() {
        var rule = HeaderToTrailerInterceptor.create().rule();
        Assert.assertEquals(PropagationRule.Mode.ALLOW, rule.mode());
        Assert.assertTrue(rule.isEligible("www-authenticate"));
        Assert.assertTrue(rule.isEligible("x-custom-test"));
        Assert.assertFalse(rule.isEligible("x-other"));
    }

    private static final class ForwardingAuthorization implements ClientInterceptor {
        @Override
        public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(MethodDescriptor<ReqT, RespT> method,
                                                                   CallOptions callOptions, Channel next)
        {
            return new ForwardingClientCall.SimpleForwardingClientCall<>(next.newCall(method, callOptions)) {
                @Override
                public void start(Listener<RespT> listener, Metadata headers) {
                    headers.put(AUTHORIZATION, "Bearer valid-token");
                    super.start(listener, headers);
                }
            };
        }
    }
}
