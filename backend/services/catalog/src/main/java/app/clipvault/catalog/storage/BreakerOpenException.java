package app.clipvault.catalog.storage;

/**
 * The gateway's circuit breaker is open; the call was not attempted.
 */
public class BreakerOpenException extends StorageOperationException {

    public BreakerOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
