package app.clipvault.catalog.reconcile;

/**
 * How an incoming event value is combined with the value already stored for a field.
 */
public enum FieldPolicy {
    /** Incoming value is written only while the stored value is empty or default. */
    FILL_IF_EMPTY,
    /** Boolean flag that may be raised by an event but never lowered. */
    ESCALATE_ONLY,
    /** Incoming value always replaces the stored one when the event carries it. */
    AUTHORITATIVE
}
