package admit.java.grpc;

import admit.core.clock.ManualClock;
import admit.java.engine.RateLimitConfig;
import admit.java.engine.RateLimiter;
import admit.java.keys.KeyExtractors;
import admit.proto.CheckRateLimitRequest;
import admit.proto.CheckRateLimitResponse;
import admit.proto.HealthCheckRequest;
import admit.proto.HealthCheckResponse;
import admit.proto.RateLimitServiceGrpc;
import io.grpc.Attributes;
import io.grpc.Context;
import io.grpc.Grpc;
import io.grpc.Contexts;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Server;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.MetadataUtils;
import io.grpc.stub.StreamObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdmissionInterceptorTest {

    private static final Metadata.Key<String> CLIENT_HEADER =
        Metadata.Key.of("x-client-id", Metadata.ASCII_STRING_MARSHALLER);

    private final AtomicInteger invocations = new AtomicInteger(0);
    private final ManualClock clock = new ManualClock(0L);

    private Server server;
    private ManagedChannel channel;

    /**
     * Counts calls that made it past admission.
     */
    private final class CountingService extends RateLimitServiceGrpc.RateLimitServiceImplBase {
        @Override
        public void checkRateLimit(CheckRateLimitRequest request, StreamObserver<CheckRateLimitResponse> observer) {
            invocations.incrementAndGet();
            observer.onNext(CheckRateLimitResponse.newBuilder().setAllowed(true).build());
            observer.onCompleted();
        }

        @Override
        public void healthCheck(HealthCheckRequest request, StreamObserver<HealthCheckResponse> observer) {
            invocations.incrementAndGet();
            observer.onNext(HealthCheckResponse.newBuilder().setStatus(HealthCheckResponse.Status.SERVING).build());
            observer.onCompleted();
        }
    }

    /**
     * Stand-in authentication step: copies a header into {@link ClientIdentity#CLIENT_ID}.
     */
    private static final class HeaderIdentityInterceptor implements ServerInterceptor {
        @Override
        public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
            String id = headers.get(CLIENT_HEADER);
            Context context = Context.current().withValue(ClientIdentity.CLIENT_ID, id == null ? "" : id);
            return Contexts.interceptCall(context, call, headers, next);
        }
    }

    @AfterEach
    void tearDown() throws Exception {
        if (channel != null) {
            channel.shutdown();
            channel.awaitTermination(5, TimeUnit.SECONDS);
        }
        if (server != null) {
            server.shutdown();
            server.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    private void start(RateLimitConfig config) throws Exception {
        RateLimiter limiter = RateLimiter.local(config, clock);

        String serverName = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(serverName)
            .directExecutor()
            // Last interceptor runs first: identity, then admission
            .addService(ServerInterceptors.intercept(
                new CountingService(), new AdmissionInterceptor(limiter), new HeaderIdentityInterceptor()))
            .build()
            .start();

        channel = InProcessChannelBuilder.forName(serverName)
            .directExecutor()
            .build();
    }

    private RateLimitServiceGrpc.RateLimitServiceBlockingStub stub(String header, String value) {
        Metadata metadata = new Metadata();
        metadata.put(Metadata.Key.of(header, Metadata.ASCII_STRING_MARSHALLER), value);
        return RateLimitServiceGrpc.newBlockingStub(channel)
            .withInterceptors(MetadataUtils.newAttachHeadersInterceptor(metadata));
    }

    private static CheckRateLimitRequest request() {
        return CheckRateLimitRequest.newBuilder().setKey("anything").build();
    }

    @Test
    void testAllowedCalls_reachService() throws Exception {
        start(RateLimitConfig.tokenBucket(2, 1.0));
        RateLimitServiceGrpc.RateLimitServiceBlockingStub stub = RateLimitServiceGrpc.newBlockingStub(channel);

        assertTrue(stub.checkRateLimit(request()).getAllowed());
        assertTrue(stub.checkRateLimit(request()).getAllowed());

        assertEquals(2, invocations.get());
    }

    @Test
    void testDeniedCall_resourceExhaustedWithReason() throws Exception {
        start(RateLimitConfig.tokenBucket(1, 1.0));
        RateLimitServiceGrpc.RateLimitServiceBlockingStub stub = RateLimitServiceGrpc.newBlockingStub(channel);

        stub.checkRateLimit(request());

        StatusRuntimeException exception = assertThrows(
            StatusRuntimeException.class,
            () -> stub.checkRateLimit(request())
        );

        assertEquals(Status.Code.RESOURCE_EXHAUSTED, exception.getStatus().getCode());
        assertNotNull(exception.getTrailers());
        assertEquals(AdmissionInterceptor.REASON_RATE_LIMIT_EXCEEDED,
            exception.getTrailers().get(AdmissionInterceptor.REASON_KEY));
        assertEquals(1, invocations.get(), "Denied call must not reach the service");
    }

    @Test
    void testRefill_admitsAgain() throws Exception {
        start(RateLimitConfig.tokenBucket(1, 1.0));
        RateLimitServiceGrpc.RateLimitServiceBlockingStub stub = RateLimitServiceGrpc.newBlockingStub(channel);

        stub.checkRateLimit(request());
        assertThrows(StatusRuntimeException.class, () -> stub.checkRateLimit(request()));

        clock.advanceMillis(1_000);

        assertTrue(stub.checkRateLimit(request()).getAllowed());
        assertEquals(2, invocations.get());
    }

    @Test
    void testByForwardedFor_separateBudgets() throws Exception {
        start(RateLimitConfig.tokenBucket(1, 1.0).withKeyExtractor(KeyExtractors.byClientAddress()));

        RateLimitServiceGrpc.RateLimitServiceBlockingStub first = stub("x-forwarded-for", "203.0.113.7, 10.0.0.1");
        RateLimitServiceGrpc.RateLimitServiceBlockingStub samePrefix = stub("x-forwarded-for", "203.0.113.7");
        RateLimitServiceGrpc.RateLimitServiceBlockingStub other = stub("x-forwarded-for", "198.51.100.2");

        assertTrue(first.checkRateLimit(request()).getAllowed());
        // Same first hop, same bucket
        assertThrows(StatusRuntimeException.class, () -> samePrefix.checkRateLimit(request()));
        assertTrue(other.checkRateLimit(request()).getAllowed());
    }

    @Test
    void testByPath_methodsHaveSeparateBudgets() throws Exception {
        start(RateLimitConfig.tokenBucket(1, 1.0).withKeyExtractor(KeyExtractors.byPath()));
        RateLimitServiceGrpc.RateLimitServiceBlockingStub stub = RateLimitServiceGrpc.newBlockingStub(channel);

        assertTrue(stub.checkRateLimit(request()).getAllowed());
        assertEquals(HealthCheckResponse.Status.SERVING,
            stub.healthCheck(HealthCheckRequest.newBuilder().build()).getStatus());

        assertThrows(StatusRuntimeException.class, () -> stub.checkRateLimit(request()));
        assertThrows(StatusRuntimeException.class, () -> stub.healthCheck(HealthCheckRequest.newBuilder().build()));
    }

    @Test
    void testByClientId_usesAuthenticatedIdentity() throws Exception {
        start(RateLimitConfig.tokenBucket(1, 1.0).withKeyExtractor(KeyExtractors.byClientId()));

        RateLimitServiceGrpc.RateLimitServiceBlockingStub alice = stub("x-client-id", "alice");
        RateLimitServiceGrpc.RateLimitServiceBlockingStub bob = stub("x-client-id", "bob");

        assertTrue(alice.checkRateLimit(request()).getAllowed());
        assertTrue(bob.checkRateLimit(request()).getAllowed());

        StatusRuntimeException exception = assertThrows(
            StatusRuntimeException.class,
            () -> alice.checkRateLimit(request())
        );
        assertEquals(Status.Code.RESOURCE_EXHAUSTED, exception.getStatus().getCode());
        assertEquals(2, invocations.get());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCancelledCall_neitherChargedNorForwarded() {
        RateLimiter limiter = RateLimiter.local(RateLimitConfig.tokenBucket(1, 1.0), clock);
        AdmissionInterceptor interceptor = new AdmissionInterceptor(limiter);
        ServerCall<String, String> call = mock(ServerCall.class);
        ServerCallHandler<String, String> next = mock(ServerCallHandler.class);

        Context.CancellableContext cancelled = Context.current().withCancellation();
        cancelled.cancel(null);
        cancelled.run(() -> interceptor.interceptCall(call, new Metadata(), next));

        verify(call).close(argThat(status -> status.getCode() == Status.Code.CANCELLED), any(Metadata.class));
        verify(next, never()).startCall(any(), any());
        assertTrue(limiter.decide("global", 0L).isAllowed(), "Cancelled call must not spend a token");
    }

    @SuppressWarnings("unchecked")
    private static ServerCall<CheckRateLimitRequest, CheckRateLimitResponse> callFrom(InetSocketAddress peer) {
        ServerCall<CheckRateLimitRequest, CheckRateLimitResponse> call = mock(ServerCall.class);
        when(call.getAttributes()).thenReturn(
            Attributes.newBuilder().set(Grpc.TRANSPORT_ATTR_REMOTE_ADDR, peer).build());
        when(call.getMethodDescriptor()).thenReturn(RateLimitServiceGrpc.getCheckRateLimitMethod());
        return call;
    }

    @Test
    void testToRequest_peerHostWithoutPort() {
        ServerCall<CheckRateLimitRequest, CheckRateLimitResponse> call =
            callFrom(new InetSocketAddress("10.1.2.3", 54321));

        assertEquals("10.1.2.3", AdmissionInterceptor.toRequest(call, new Metadata()).remoteAddress());
        assertEquals("/admit.RateLimitService/CheckRateLimit",
            AdmissionInterceptor.toRequest(call, new Metadata()).path());
    }

    @Test
    void testToRequest_sameClientNewConnection_sameKey() {
        RateLimiter limiter = RateLimiter.local(
            RateLimitConfig.tokenBucket(1, 1.0).withKeyExtractor(KeyExtractors.byClientAddress()), clock);

        String first = limiter.keyFor(AdmissionInterceptor.toRequest(
            callFrom(new InetSocketAddress("10.1.2.3", 40000)), new Metadata()));
        String second = limiter.keyFor(AdmissionInterceptor.toRequest(
            callFrom(new InetSocketAddress("10.1.2.3", 40001)), new Metadata()));

        assertEquals("10.1.2.3", first);
        assertEquals(first, second);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testDeny_skipsKeyLoggingWhenDebugOff() {
        // logback-test.xml keeps the admit loggers at INFO
        RateLimiter limiter = spy(RateLimiter.local(RateLimitConfig.tokenBucket(1, 1.0), clock));
        AdmissionInterceptor interceptor = new AdmissionInterceptor(limiter);
        ServerCallHandler<CheckRateLimitRequest, CheckRateLimitResponse> next = mock(ServerCallHandler.class);
        ServerCall<CheckRateLimitRequest, CheckRateLimitResponse> call =
            callFrom(new InetSocketAddress("10.1.2.3", 40000));

        interceptor.interceptCall(call, new Metadata(), next);
        interceptor.interceptCall(call, new Metadata(), next);

        verify(call).close(argThat(status -> status.getCode() == Status.Code.RESOURCE_EXHAUSTED), any(Metadata.class));
        verify(next).startCall(any(), any());
        // One extraction per decide(request); none extra for the DEBUG line
        verify(limiter, times(2)).keyFor(any());
    }

    @Test
    void testConstructor_nullLimiter() {
        assertThrows(IllegalArgumentException.class, () -> new AdmissionInterceptor(null));
    }
}
