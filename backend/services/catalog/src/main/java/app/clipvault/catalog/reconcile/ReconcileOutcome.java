package app.clipvault.catalog.reconcile;

public enum ReconcileOutcome {
    CREATED,
    UPDATED,
    UNCHANGED
}
