package app.clipvault.catalog.storage;

public class DeadlineExceededException extends StorageOperationException {

    public DeadlineExceededException(String message) {
        super(message);
    }
}
