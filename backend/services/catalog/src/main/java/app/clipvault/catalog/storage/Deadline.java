package app.clipvault.catalog.storage;

import java.time.Duration;
import java.time.Instant;

/**
 * Point in time after which no further remote call may be started for an operation.
 */
public record Deadline(Instant expiresAt) {

    public static Deadline at(Instant expiresAt) {
        return new Deadline(expiresAt);
    }

    public static Deadline in(Duration budget) {
        return new Deadline(Instant.now().plus(budget));
    }

    public static Deadline none() {
        return new Deadline(null);
    }

    public boolean isExpired() {
        return expiresAt != null && !Instant.now().isBefore(expiresAt);
    }

    public Duration remaining() {
        if (expiresAt == null) {
            return null;
        }
        Duration remaining = Duration.between(Instant.now(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * The smaller of {@code timeout} and the time left before this deadline.
     */
    public Duration cap(Duration timeout) {
        Duration remaining = remaining();
        if (remaining == null) {
            return timeout;
        }
        return remaining.compareTo(timeout) < 0 ? remaining : timeout;
    }

    public void check(String operation) {
        if (isExpired()) {
            throw new DeadlineExceededException("Deadline reached before " + operation);
        }
    }
}
