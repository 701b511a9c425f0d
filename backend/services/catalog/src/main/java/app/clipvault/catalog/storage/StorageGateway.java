package app.clipvault.catalog.storage;

/**
 * Remote object store operations used by asset deletion. Every method is bounded by the
 * gateway's timeouts and by the caller's {@link Deadline}.
 *
 * @see ResilientStorageGateway
 */
public interface StorageGateway {
    boolean exists(String key, Deadline deadline);

    void deleteObject(String key, Deadline deadline);

    /**
     * Deletes every object whose key starts with {@code prefix}.
     *
     * @return number of objects deleted
     */
    int deleteByPrefix(String prefix, Deadline deadline);
}
