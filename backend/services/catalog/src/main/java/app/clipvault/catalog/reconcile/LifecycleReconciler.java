package app.clipvault.catalog.reconcile;

import app.clipvault.catalog.domain.entity.VideoAssetEntity;
import app.clipvault.catalog.event.AssetFinalizedEvent;
import app.clipvault.catalog.event.AssetRegisteredEvent;
import app.clipvault.catalog.repository.VideoAssetRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Folds asset-registered and asset-finalized deliveries into exactly one catalog record per
 * external id. Both handlers are idempotent and commute with each other, so redelivery and
 * arbitrary arrival order converge on the same row.
 */
@Service
public class LifecycleReconciler {

    private static final Logger log = LoggerFactory.getLogger(LifecycleReconciler.class);
    private static final String EXTERNAL_ID_CONSTRAINT = "uq_video_assets_external_id";
    private static final String UNIQUE_VIOLATION = "23505";

    private final VideoAssetRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;

    public LifecycleReconciler(VideoAssetRepository repository,
                               PlatformTransactionManager transactionManager,
                               @Value("${app.catalog.reconcile.max-attempts:3}") int maxAttempts) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.maxAttempts = Math.max(maxAttempts, 1);
    }

    public ReconcileOutcome handleRegistered(AssetRegisteredEvent event) {
        if (event == null) {
            throw new InvalidEventException("Registration event is empty");
        }
        AssetPatch patch = AssetPatch.fromRegistration(event);
        if (patch.externalId() == null || patch.ownerId() == null) {
            throw new InvalidEventException("Registration event requires uploadId and userId");
        }
        return reconcile(patch, "registered");
    }

    public ReconcileOutcome handleFinalized(AssetFinalizedEvent event) {
        if (event == null) {
            throw new InvalidEventException("Finalization event is empty");
        }
        AssetPatch patch = AssetPatch.fromFinalization(event);
        if (patch.externalId() == null) {
            throw new InvalidEventException("Finalization event requires uploadId");
        }
        return reconcile(patch, "finalized");
    }

    private ReconcileOutcome reconcile(AssetPatch patch, String source) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> mergeOnce(patch, source));
            } catch (DataIntegrityViolationException ex) {
                if (!isExternalIdCollision(ex)) {
                    throw new InvalidEventException(
                            "Catalog store rejected event values for externalId=" + patch.externalId(), ex);
                }
                // another stream created the same external id between our read and our write
                onConflict(patch, source, attempt, ex);
            } catch (OptimisticLockingFailureException ex) {
                onConflict(patch, source, attempt, ex);
            } catch (DataAccessException | TransactionException ex) {
                throw new CatalogStoreException("Catalog store failed for externalId=" + patch.externalId(), ex);
            }
        }
    }

    private void onConflict(AssetPatch patch, String source, int attempt, DataAccessException ex) {
        if (attempt >= maxAttempts) {
            throw new CatalogStoreException(
                    "Concurrent writes kept conflicting for externalId=" + patch.externalId(), ex);
        }
        log.info("Catalog merge conflict externalId={} source={} attempt={} error={}",
                patch.externalId(), source, attempt, ex.getClass().getSimpleName());
    }

    /**
     * Only a duplicate external id is a lost race; length, not-null and check violations come from
     * the event itself and fail the same way on every attempt.
     */
    static boolean isExternalIdCollision(DataIntegrityViolationException ex) {
        for (Throwable cause = ex.getCause(); cause != null && cause != cause.getCause(); cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation && violation.getConstraintName() != null) {
                return EXTERNAL_ID_CONSTRAINT.equalsIgnoreCase(violation.getConstraintName());
            }
            if (cause instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private ReconcileOutcome mergeOnce(AssetPatch patch, String source) {
        Optional<VideoAssetEntity> existing = repository.findByExternalId(patch.externalId());
        Instant now = Instant.now();

        if (existing.isEmpty()) {
            if (patch.ownerId() == null) {
                throw new InvalidEventException(
                        "Cannot create catalog record without userId, externalId=" + patch.externalId());
            }
            VideoAssetEntity created = VideoAssetEntity.placeholder(patch.externalId(), patch.ownerId(), now);
            AssetMergeRules.apply(created, patch);
            repository.saveAndFlush(created);
            log.info("Catalog record created externalId={} assetId={} source={} status={}",
                    patch.externalId(), created.getAssetId(), source, created.getStatus());
            return ReconcileOutcome.CREATED;
        }

        VideoAssetEntity asset = existing.get();
        List<String> changed = AssetMergeRules.apply(asset, patch);
        if (changed.isEmpty()) {
            log.debug("Catalog merge no-op externalId={} assetId={} source={}",
                    patch.externalId(), asset.getAssetId(), source);
            return ReconcileOutcome.UNCHANGED;
        }
        asset.setUpdatedAt(now);
        repository.saveAndFlush(asset);
        log.info("Catalog record merged externalId={} assetId={} source={} fields={} status={}",
                patch.externalId(), asset.getAssetId(), source, changed, asset.getStatus());
        return ReconcileOutcome.UPDATED;
    }
}
