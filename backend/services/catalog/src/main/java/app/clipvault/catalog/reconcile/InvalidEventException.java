package app.clipvault.catalog.reconcile;

/**
 * The delivery can never be applied, however often it is redelivered.
 */
public class InvalidEventException extends RuntimeException {

    public InvalidEventException(String message) {
        super(message);
    }

    public InvalidEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
