package app.clipvault.catalog.service;

import app.clipvault.catalog.config.DeletionProps;
import app.clipvault.catalog.deletion.DeletionOrchestrator;
import app.clipvault.catalog.deletion.DeletionResult;
import app.clipvault.catalog.domain.entity.VideoAssetEntity;
import app.clipvault.catalog.event.AssetFinalizedEvent;
import app.clipvault.catalog.event.AssetRegisteredEvent;
import app.clipvault.catalog.event.TagLists;
import app.clipvault.catalog.reconcile.LifecycleReconciler;
import app.clipvault.catalog.repository.VideoAssetRepository;
import app.clipvault.catalog.service.dto.AssetEditRequest;
import app.clipvault.catalog.service.dto.AssetView;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.Instant;

/**
 * Entry point for callers outside the event streams: lookups, owner edits and complete deletion.
 */
@Service
@Validated
public class AssetCatalogService {

    private static final Logger log = LoggerFactory.getLogger(AssetCatalogService.class);

    private final VideoAssetRepository repository;
    private final LifecycleReconciler reconciler;
    private final DeletionOrchestrator deletionOrchestrator;
    private final Duration defaultDeadline;

    public AssetCatalogService(VideoAssetRepository repository,
                               LifecycleReconciler reconciler,
                               DeletionOrchestrator deletionOrchestrator,
                               DeletionProps deletionProps) {
        this.repository = repository;
        this.reconciler = reconciler;
        this.deletionOrchestrator = deletionOrchestrator;
        this.defaultDeadline = deletionProps.defaultDeadline();
    }

    public void registerAsset(AssetRegisteredEvent event) {
        reconciler.handleRegistered(event);
    }

    public void finalizeAsset(AssetFinalizedEvent event) {
        reconciler.handleFinalized(event);
    }

    public DeletionResult deleteAssetCompletely(Long assetId) {
        return deleteAssetCompletely(assetId, Instant.now().plus(defaultDeadline));
    }

    public DeletionResult deleteAssetCompletely(Long assetId, Instant deadline) {
        return deletionOrchestrator.deleteCompletely(assetId, deadline);
    }

    @Transactional(readOnly = true)
    public AssetView getAsset(Long assetId) {
        return repository.findById(assetId)
                .map(AssetView::from)
                .orElseThrow(() -> new AssetNotFoundException("Asset not found: " + assetId));
    }

    @Transactional(readOnly = true)
    public AssetView getAssetByExternalId(String externalId) {
        return repository.findByExternalId(externalId)
                .map(AssetView::from)
                .orElseThrow(() -> new AssetNotFoundException("Asset not found for externalId: " + externalId));
    }

    @Transactional
    public AssetView editAsset(Long assetId, @Valid AssetEditRequest request) {
        VideoAssetEntity asset = repository.findById(assetId)
                .orElseThrow(() -> new AssetNotFoundException("Asset not found: " + assetId));

        if (request.title() != null && !request.title().isBlank()) {
            asset.setTitle(request.title().trim());
        }
        if (request.description() != null) {
            asset.setDescription(request.description().isBlank() ? null : request.description().trim());
        }
        if (request.tags() != null) {
            asset.setTags(TagLists.normalize(request.tags()));
        }
        if (request.category() != null) {
            asset.setCategory(request.category().isBlank() ? null : request.category().trim());
        }
        if (request.isPrivate() != null) {
            asset.setPrivateFlag(request.isPrivate());
        }
        asset.setUpdatedAt(Instant.now());

        VideoAssetEntity saved = repository.save(asset);
        log.info("Asset edited assetId={} externalId={}", assetId, saved.getExternalId());
        return AssetView.from(saved);
    }
}
