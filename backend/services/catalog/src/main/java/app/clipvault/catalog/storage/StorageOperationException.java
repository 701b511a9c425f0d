package app.clipvault.catalog.storage;

/**
 * A storage call failed after the gateway exhausted its retries.
 */
public class StorageOperationException extends RuntimeException {

    public StorageOperationException(String message) {
        super(message);
    }

    public StorageOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
