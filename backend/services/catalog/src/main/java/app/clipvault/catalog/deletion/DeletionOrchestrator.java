package app.clipvault.catalog.deletion;

import app.clipvault.catalog.config.DeletionProps;
import app.clipvault.catalog.domain.entity.VideoAssetEntity;
import app.clipvault.catalog.repository.VideoAssetRepository;
import app.clipvault.catalog.storage.Deadline;
import app.clipvault.catalog.storage.DeadlineExceededException;
import app.clipvault.catalog.storage.StorageGateway;
import app.clipvault.catalog.storage.StorageOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Removes an asset together with every storage location it owns.
 * <p>
 * Storage is cleaned first, best effort: each failing object or prefix is logged and skipped,
 * an open circuit breaker included. Only the deadline stops the pass early.
 * The catalog row goes last because it holds the only copy of the paths; while it exists the
 * whole call can be repeated, and objects already gone are skipped by the existence check.
 */
@Service
public class DeletionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DeletionOrchestrator.class);

    private final VideoAssetRepository repository;
    private final StorageGateway storage;
    private final DeletionPlanner planner;
    private final boolean catalogOnlyFallback;

    public DeletionOrchestrator(VideoAssetRepository repository,
                                Optional<StorageGateway> storage,
                                DeletionPlanner planner,
                                DeletionProps props) {
        this.repository = repository;
        this.storage = storage.orElse(null);
        this.planner = planner;
        this.catalogOnlyFallback = props.catalogOnlyFallback();

        if (this.storage == null) {
            if (catalogOnlyFallback) {
                log.warn("Object storage disabled, deletions will remove catalog rows only and orphan stored files");
            } else {
                log.warn("Object storage disabled, deletions will be refused");
            }
        }
    }

    public DeletionResult deleteCompletely(Long assetId, Instant deadline) {
        VideoAssetEntity asset;
        try {
            asset = repository.findById(assetId).orElse(null);
        } catch (DataAccessException ex) {
            log.error("Asset lookup failed assetId={}", assetId, ex);
            return DeletionResult.of(assetId, DeletionOutcome.STORE_FAILURE);
        }
        if (asset == null) {
            log.info("Asset already absent assetId={}", assetId);
            return DeletionResult.of(assetId, DeletionOutcome.NOT_FOUND);
        }

        DeletionPlan plan = planner.plan(asset);

        if (storage == null) {
            if (!catalogOnlyFallback) {
                log.warn("Asset deletion refused, object storage unavailable assetId={} externalId={}",
                        assetId, asset.getExternalId());
                return DeletionResult.of(assetId, DeletionOutcome.STORAGE_UNAVAILABLE);
            }
            log.warn("Deleting catalog row only assetId={} externalId={} orphanedLocations={}",
                    assetId, asset.getExternalId(), plan.allLocations());
            return removeRow(assetId, asset, DeletionOutcome.DELETED_CATALOG_ONLY, 0, 0, plan.allLocations());
        }

        Deadline bound = deadline == null ? Deadline.none() : Deadline.at(deadline);
        int objectsDeleted = 0;
        int prefixesPurged = 0;
        List<String> failed = new ArrayList<>();

        try {
            for (String key : plan.objectKeys()) {
                try {
                    if (!storage.exists(key, bound)) {
                        log.debug("Object already absent assetId={} key={}", assetId, key);
                        continue;
                    }
                    storage.deleteObject(key, bound);
                    objectsDeleted++;
                } catch (DeadlineExceededException ex) {
                    throw ex;
                } catch (StorageOperationException ex) {
                    failed.add(key);
                    log.warn("Object delete failed assetId={} key={} error={}", assetId, key, ex.getMessage());
                }
            }

            for (String prefix : plan.prefixes()) {
                try {
                    objectsDeleted += storage.deleteByPrefix(prefix, bound);
                    prefixesPurged++;
                } catch (DeadlineExceededException ex) {
                    throw ex;
                } catch (StorageOperationException ex) {
                    failed.add(prefix);
                    log.warn("Prefix purge failed assetId={} prefix={} error={}", assetId, prefix, ex.getMessage());
                }
            }
        } catch (DeadlineExceededException ex) {
            log.warn("Asset deletion hit its deadline, catalog row kept assetId={} objectsDeleted={} prefixesPurged={}",
                    assetId, objectsDeleted, prefixesPurged);
            return new DeletionResult(assetId, DeletionOutcome.DEADLINE_EXCEEDED, objectsDeleted, prefixesPurged, failed);
        }

        DeletionOutcome outcome = failed.isEmpty()
                ? DeletionOutcome.DELETED
                : DeletionOutcome.DELETED_WITH_STORAGE_FAILURES;
        return removeRow(assetId, asset, outcome, objectsDeleted, prefixesPurged, failed);
    }

    private DeletionResult removeRow(Long assetId,
                                     VideoAssetEntity asset,
                                     DeletionOutcome outcome,
                                     int objectsDeleted,
                                     int prefixesPurged,
                                     List<String> failed) {
        try {
            repository.delete(asset);
        } catch (DataAccessException ex) {
            log.error("Catalog row delete failed, row kept assetId={} externalId={}",
                    assetId, asset.getExternalId(), ex);
            return new DeletionResult(assetId, DeletionOutcome.STORE_FAILURE, objectsDeleted, prefixesPurged, failed);
        }
        log.info("Asset deleted assetId={} externalId={} outcome={} objectsDeleted={} prefixesPurged={} failed={}",
                assetId, asset.getExternalId(), outcome, objectsDeleted, prefixesPurged, failed);
        return new DeletionResult(assetId, outcome, objectsDeleted, prefixesPurged, failed);
    }
}
