package app.clipvault.catalog.storage;

import java.time.Duration;

/**
 * Single remote calls against the blob store. Implementations do not retry; every call gives
 * up after {@code timeout}.
 */
public interface ObjectStorage {
    boolean objectExists(String key, Duration timeout);

    void deleteObject(String key, Duration timeout);

    ObjectListing listObjects(String prefix, String continuationToken, Duration timeout);
}
