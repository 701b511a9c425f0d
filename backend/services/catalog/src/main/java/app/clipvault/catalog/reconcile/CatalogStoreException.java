package app.clipvault.catalog.reconcile;

/**
 * The relational store rejected or failed a catalog write; nothing of the operation was committed.
 */
public class CatalogStoreException extends RuntimeException {

    public CatalogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
