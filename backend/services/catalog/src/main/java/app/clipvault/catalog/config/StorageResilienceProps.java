package app.clipvault.catalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.storage.resilience")
public record StorageResilienceProps(
        Duration attemptTimeout,
        Integer maxRetries,
        Duration backoffBase,
        Duration backoffMax,
        Integer breakerFailureThreshold,
        Duration breakerCooldown
) {
    public StorageResilienceProps {
        attemptTimeout = positiveOr(attemptTimeout, Duration.ofSeconds(3));
        maxRetries = maxRetries == null || maxRetries < 0 ? 2 : maxRetries;
        backoffBase = positiveOr(backoffBase, Duration.ofMillis(200));
        backoffMax = positiveOr(backoffMax, Duration.ofMillis(1500));
        if (backoffMax.compareTo(backoffBase) < 0) {
            backoffMax = backoffBase;
        }
        breakerFailureThreshold = breakerFailureThreshold == null || breakerFailureThreshold < 1 ? 5 : breakerFailureThreshold;
        breakerCooldown = positiveOr(breakerCooldown, Duration.ofSeconds(10));
    }

    public static StorageResilienceProps defaults() {
        return new StorageResilienceProps(null, null, null, null, null, null);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}
