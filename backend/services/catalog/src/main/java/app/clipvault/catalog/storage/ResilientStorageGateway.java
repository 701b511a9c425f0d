package app.clipvault.catalog.storage;

import app.clipvault.catalog.config.StorageResilienceProps;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link StorageGateway} over a bare {@link ObjectStorage}. Each remote call gets a per-attempt
 * timeout (capped by the caller's deadline), exponential-backoff retries and a circuit breaker
 * shared by all calls of this gateway.
 * <p>
 * Retry wraps the breaker, so every attempt is counted by the breaker and an open breaker is
 * never retried: once it trips, the rest of the current call fails fast.
 * <p>
 * The breaker is count-based over the last {@code breakerFailureThreshold} calls with a 100%
 * failure-rate threshold, which makes it open after that many consecutive failures. After
 * {@code breakerCooldown} it lets a single probe through.
 */
@Component
@ConditionalOnProperty(prefix = "app.s3", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ResilientStorageGateway implements StorageGateway {

    private static final Logger log = LoggerFactory.getLogger(ResilientStorageGateway.class);

    private final ObjectStorage storage;
    private final Duration attemptTimeout;
    private final int maxAttempts;
    private final IntervalFunction backoff;
    private final CircuitBreaker circuitBreaker;

    public ResilientStorageGateway(ObjectStorage storage, StorageResilienceProps props) {
        this.storage = storage;
        this.attemptTimeout = props.attemptTimeout();
        this.maxAttempts = props.maxRetries() + 1;
        this.backoff = IntervalFunction.ofExponentialBackoff(props.backoffBase(), 2.0, props.backoffMax());

        CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(props.breakerFailureThreshold())
                .minimumNumberOfCalls(props.breakerFailureThreshold())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(props.breakerCooldown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .ignoreExceptions(DeadlineExceededException.class)
                .build();
        this.circuitBreaker = CircuitBreaker.of("object-storage", breakerConfig);
        this.circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Object storage circuit breaker transition={}", event.getStateTransition()));
    }

    @Override
    public boolean exists(String key, Deadline deadline) {
        return call("exists", key, deadline, timeout -> storage.objectExists(key, timeout));
    }

    @Override
    public void deleteObject(String key, Deadline deadline) {
        call("delete", key, deadline, timeout -> {
            storage.deleteObject(key, timeout);
            return null;
        });
    }

    @Override
    public int deleteByPrefix(String prefix, Deadline deadline) {
        int deleted = 0;
        int failed = 0;
        String continuationToken = null;
        ObjectListing page;
        do {
            String token = continuationToken;
            page = call("list", prefix, deadline, timeout -> storage.listObjects(prefix, token, timeout));
            for (String key : page.keys()) {
                try {
                    deleteObject(key, deadline);
                    deleted++;
                } catch (BreakerOpenException | DeadlineExceededException ex) {
                    throw ex;
                } catch (StorageOperationException ex) {
                    failed++;
                    log.warn("Object delete under prefix failed prefix={} key={} error={}",
                            prefix, key, ex.getMessage());
                }
            }
            continuationToken = page.nextContinuationToken();
        } while (page.hasMore());

        if (failed > 0) {
            throw new StorageOperationException(
                    failed + " of " + (deleted + failed) + " objects under prefix " + prefix + " were not deleted");
        }
        return deleted;
    }

    public CircuitBreaker.State circuitBreakerState() {
        return circuitBreaker.getState();
    }

    /**
     * Backoff waits never run past the deadline; the attempt after a shortened wait fails its
     * deadline check instead of reaching storage.
     */
    private Retry retryWithin(Deadline deadline) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(attempt -> {
                    long interval = backoff.apply(attempt);
                    Duration remaining = deadline.remaining();
                    // rounded up so the next attempt sees the deadline as reached
                    return remaining == null ? interval : Math.min(interval, remaining.toMillis() + 1);
                })
                .retryOnException(ex -> !(ex instanceof CallNotPermittedException)
                        && !(ex instanceof DeadlineExceededException))
                .build();
        return Retry.of("object-storage", config);
    }

    private <T> T call(String operation, String key, Deadline deadline, Function<Duration, T> remoteCall) {
        Supplier<T> attempt = () -> {
            deadline.check(operation + " " + key);
            Duration timeout = deadline.cap(attemptTimeout);
            if (timeout.isZero() || timeout.isNegative()) {
                throw new DeadlineExceededException("Deadline reached before " + operation + " " + key);
            }
            return circuitBreaker.executeSupplier(() -> remoteCall.apply(timeout));
        };
        try {
            return Retry.decorateSupplier(retryWithin(deadline), attempt).get();
        } catch (CallNotPermittedException ex) {
            throw new BreakerOpenException("Object storage circuit breaker is open, skipped " + operation + " " + key, ex);
        } catch (DeadlineExceededException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new StorageOperationException(
                    operation + " " + key + " failed after " + maxAttempts + " attempts: " + ex.getMessage(), ex);
        }
    }
}
