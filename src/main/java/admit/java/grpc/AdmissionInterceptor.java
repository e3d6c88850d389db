package admit.java.grpc;

import admit.core.model.Decision;
import admit.java.engine.RateLimiter;
import admit.java.keys.AdmissionRequest;
import io.grpc.Context;
import io.grpc.Grpc;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.HashMap;
import java.util.Map;

/**
 * Server interceptor that admits or rejects each call before it reaches the service.
 *
 * <p>On ALLOW the call is passed on untouched. On DENY the call is closed with
 * {@code RESOURCE_EXHAUSTED} (the gRPC counterpart of HTTP 429) and a
 * {@code ratelimit-reason: rate_limit_exceeded} trailer; the service is never invoked.
 *
 * <p>Register it after any authentication interceptor so that {@link ClientIdentity} is set:
 * <pre>
 * ServerInterceptors.intercept(service, new AdmissionInterceptor(limiter), authInterceptor)
 * </pre>
 */
public final class AdmissionInterceptor implements ServerInterceptor {

    private static final Logger LOG = LoggerFactory.getLogger(AdmissionInterceptor.class);

    public static final String REASON_RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";
    public static final Metadata.Key<String> REASON_KEY =
        Metadata.Key.of("ratelimit-reason", Metadata.ASCII_STRING_MARSHALLER);

    private final RateLimiter limiter;

    /**
     * @param limiter Rate limiter (must be thread-safe)
     * @throws IllegalArgumentException if limiter is null
     */
    public AdmissionInterceptor(RateLimiter limiter) {
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
        this.limiter = limiter;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
        ServerCall<ReqT, RespT> call,
        Metadata headers,
        ServerCallHandler<ReqT, RespT> next
    ) {
        if (Context.current().isCancelled()) {
            call.close(Status.CANCELLED.withDescription("call cancelled before admission"), new Metadata());
            return new ServerCall.Listener<>() {};
        }

        AdmissionRequest request = toRequest(call, headers);
        Decision decision = limiter.decide(request);

        if (decision == Decision.DENY) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Rejected {} for key {}", request.path(), limiter.keyFor(request));
            }
            Metadata trailers = new Metadata();
            trailers.put(REASON_KEY, REASON_RATE_LIMIT_EXCEEDED);
            call.close(Status.RESOURCE_EXHAUSTED.withDescription("rate limit exceeded"), trailers);
            return new ServerCall.Listener<>() {};
        }

        return next.startCall(call, headers);
    }

    static AdmissionRequest toRequest(ServerCall<?, ?> call, Metadata headers) {
        Map<String, String> values = new HashMap<>();
        for (String name : headers.keys()) {
            if (name.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
                continue;
            }
            String value = headers.get(Metadata.Key.of(name, Metadata.ASCII_STRING_MARSHALLER));
            if (value != null) {
                values.put(name, value);
            }
        }

        return new AdmissionRequest(
            remoteAddress(call.getAttributes().get(Grpc.TRANSPORT_ATTR_REMOTE_ADDR)),
            "/" + call.getMethodDescriptor().getFullMethodName(),
            values,
            ClientIdentity.current()
        );
    }

    // Host only, unlike a raw peer string: the ephemeral port changes per connection and would
    // split one client's budget
    private static String remoteAddress(SocketAddress address) {
        if (address == null) {
            return "";
        }
        if (address instanceof InetSocketAddress inet) {
            return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        }
        return address.toString();
    }
}
