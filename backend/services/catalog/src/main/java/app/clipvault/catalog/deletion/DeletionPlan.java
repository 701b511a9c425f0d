package app.clipvault.catalog.deletion;

import java.util.ArrayList;
import java.util.List;

/**
 * Remote locations owned by one asset: single objects removed one by one and folder prefixes
 * purged by listing.
 */
public record DeletionPlan(List<String> objectKeys, List<String> prefixes) {

    public DeletionPlan {
        objectKeys = objectKeys == null ? List.of() : List.copyOf(objectKeys);
        prefixes = prefixes == null ? List.of() : List.copyOf(prefixes);
    }

    public List<String> allLocations() {
        List<String> all = new ArrayList<>(objectKeys);
        all.addAll(prefixes);
        return all;
    }
}
