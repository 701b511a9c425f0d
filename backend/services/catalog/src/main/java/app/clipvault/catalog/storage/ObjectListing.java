package app.clipvault.catalog.storage;

import java.util.List;

public record ObjectListing(
        List<String> keys,
        String nextContinuationToken
) {
    public ObjectListing {
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public boolean hasMore() {
        return nextContinuationToken != null && !nextContinuationToken.isBlank();
    }
}
