package app.clipvault.catalog.deletion;

public enum DeletionOutcome {
    DELETED,
    DELETED_WITH_STORAGE_FAILURES,
    DELETED_CATALOG_ONLY,
    NOT_FOUND,
    STORE_FAILURE,
    DEADLINE_EXCEEDED,
    STORAGE_UNAVAILABLE;

    public boolean rowRemoved() {
        return this == DELETED || this == DELETED_WITH_STORAGE_FAILURES || this == DELETED_CATALOG_ONLY;
    }
}
