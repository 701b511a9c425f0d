package app.clipvault.catalog.domain.type;

/**
 * Lifecycle of a catalog record. Status moves forward only; {@code failed} can be entered
 * from any state that is not yet {@code ready}, and {@code ready} is terminal for events.
 */
public enum AssetStatus {
    registered,
    processing,
    ready,
    failed;

    public static AssetStatus advance(AssetStatus current, AssetStatus target) {
        if (target == null) {
            return current;
        }
        if (current == null) {
            return target;
        }
        if (current == ready) {
            return ready;
        }
        if (target == failed) {
            return failed;
        }
        if (current == failed) {
            // a late finalization still wins over a failure report
            return target == ready ? ready : failed;
        }
        return target.ordinal() > current.ordinal() ? target : current;
    }
}
