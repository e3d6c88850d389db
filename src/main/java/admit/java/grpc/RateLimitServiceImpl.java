package admit.java.grpc;

import admit.core.model.Decision;
import admit.java.engine.RateLimiter;
import admit.proto.CheckRateLimitRequest;
import admit.proto.CheckRateLimitResponse;
import admit.proto.HealthCheckRequest;
import admit.proto.HealthCheckResponse;
import admit.proto.RateLimitServiceGrpc;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * gRPC decision service: spends one token from the bucket of the given key.
 *
 * <p>This is a thin wrapper over RateLimiter with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT); unlike {@link RateLimiter#decide(String, long)},
 *       an empty key is rejected, since an unset proto string cannot be told apart from ""</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 *   <li>Caller clock: now_millis = 0 means the limiter's own clock</li>
 * </ul>
 *
 * <p>Thread-safety: RateLimiter handles concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class RateLimitServiceImpl extends RateLimitServiceGrpc.RateLimitServiceImplBase {

    private static final Logger LOG = LoggerFactory.getLogger(RateLimitServiceImpl.class);

    private final RateLimiter limiter;

    /**
     * @param limiter Rate limiter (must be thread-safe)
     * @throws IllegalArgumentException if limiter is null
     */
    public RateLimitServiceImpl(RateLimiter limiter) {
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
        this.limiter = limiter;
    }

    @Override
    public void checkRateLimit(
        CheckRateLimitRequest request,
        StreamObserver<CheckRateLimitResponse> responseObserver
    ) {
        try {
            // Protobuf strings are never null, only empty
            if (request.getKey().isEmpty()) {
                responseObserver.onError(
                    Status.INVALID_ARGUMENT
                        .withDescription("key must not be empty")
                        .asRuntimeException()
                );
                return;
            }

            if (request.getNowMillis() < 0) {
                responseObserver.onError(
                    Status.INVALID_ARGUMENT
                        .withDescription("now_millis must be >= 0, got: " + request.getNowMillis())
                        .asRuntimeException()
                );
                return;
            }

            long now = request.getNowMillis() == 0
                ? limiter.clock().nowMillis()
                : request.getNowMillis();

            Decision decision = limiter.decide(request.getKey(), now);

            responseObserver.onNext(CheckRateLimitResponse.newBuilder()
                .setAllowed(decision.isAllowed())
                .build());
            responseObserver.onCompleted();

        } catch (IllegalArgumentException e) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        } catch (Exception e) {
            LOG.error("Rate limit check failed for key {}", request.getKey(), e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("Internal error: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        }
    }

    @Override
    public void healthCheck(
        HealthCheckRequest request,
        StreamObserver<HealthCheckResponse> responseObserver
    ) {
        // If we can respond, we're serving
        responseObserver.onNext(HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build());
        responseObserver.onCompleted();
    }
}
