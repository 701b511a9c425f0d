package app.clipvault.catalog.deletion;

import java.util.List;

public record DeletionResult(
        Long assetId,
        DeletionOutcome outcome,
        int objectsDeleted,
        int prefixesPurged,
        List<String> failedLocations
) {

    public DeletionResult {
        failedLocations = failedLocations == null ? List.of() : List.copyOf(failedLocations);
    }

    public static DeletionResult of(Long assetId, DeletionOutcome outcome) {
        return new DeletionResult(assetId, outcome, 0, 0, List.of());
    }
}
