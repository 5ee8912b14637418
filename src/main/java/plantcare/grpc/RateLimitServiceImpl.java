package plantcare.grpc;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import plantcare.core.model.RateLimitResult;
import plantcare.engine.RateLimiterEngine;
import plantcare.proto.CheckRateLimitRequest;
import plantcare.proto.CheckRateLimitResponse;
import plantcare.proto.HealthCheckRequest;
import plantcare.proto.HealthCheckResponse;
import plantcare.proto.RateLimitServiceGrpc;

/**
 * gRPC service implementation for rate limit checks.
 *
 * <p>Lets other plant-care services share this process's limiter. A thin wrapper
 * over RateLimiterEngine with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 *   <li>Protobuf conversion (RateLimitResult → CheckRateLimitResponse)</li>
 * </ul>
 *
 * <p>Thread-safety: RateLimiterEngine handles concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class RateLimitServiceImpl extends RateLimitServiceGrpc.RateLimitServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(RateLimitServiceImpl.class);

    private final RateLimiterEngine engine;

    /**
     * @param engine Rate limiter engine (must be thread-safe)
     * @throws IllegalArgumentException if engine is null
     */
    public RateLimitServiceImpl(RateLimiterEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        this.engine = engine;
    }

    @Override
    public void checkRateLimit(
        CheckRateLimitRequest request,
        StreamObserver<CheckRateLimitResponse> responseObserver
    ) {
        try {
            // Protobuf strings are never null, only empty
            if (request.getPath().isEmpty()) {
                responseObserver.onError(
                    Status.INVALID_ARGUMENT
                        .withDescription("path must not be empty")
                        .asRuntimeException()
                );
                return;
            }

            // Empty client keys fall back to "unknown" inside the engine
            RateLimitResult result = engine.check(request.getClientKey(), request.getPath());

            CheckRateLimitResponse response = CheckRateLimitResponse.newBuilder()
                .setAllowed(result.admitted())
                .setExempt(result.exempt())
                .setLimit(result.limit())
                .setRemaining(result.remaining())
                .setResetEpochSeconds(result.resetEpochSeconds())
                .setRetryAfterSeconds(result.retryAfterSeconds())
                .build();

            responseObserver.onNext(response);
            responseObserver.onCompleted();

        } catch (Exception e) {
            log.error("CheckRateLimit failed for client {}", request.getClientKey(), e);
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
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }
}
