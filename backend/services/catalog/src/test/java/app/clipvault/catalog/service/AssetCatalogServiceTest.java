package app.clipvault.catalog.service;

import app.clipvault.catalog.config.DeletionProps;
import app.clipvault.catalog.deletion.DeletionOrchestrator;
import app.clipvault.catalog.deletion.DeletionOutcome;
import app.clipvault.catalog.deletion.DeletionResult;
import app.clipvault.catalog.domain.entity.VideoAssetEntity;
import app.clipvault.catalog.reconcile.LifecycleReconciler;
import app.clipvault.catalog.repository.VideoAssetRepository;
import app.clipvault.catalog.service.dto.AssetEditRequest;
import app.clipvault.catalog.service.dto.AssetView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AssetCatalogServiceTest {

    @Mock
    VideoAssetRepository repository;

    @Mock
    LifecycleReconciler reconciler;

    @Mock
    DeletionOrchestrator deletionOrchestrator;

    AssetCatalogService service;

    @BeforeEach
    void setup() {
        service = new AssetCatalogService(repository, reconciler, deletionOrchestrator,
                new DeletionProps(false, Duration.ofSeconds(20)));
    }

    @Test
    void getAsset_missingRecordThrowsNotFound() {
        when(repository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getAsset(5L)).isInstanceOf(AssetNotFoundException.class);
    }

    @Test
    void getAssetByExternalId_mapsEntity() {
        VideoAssetEntity asset = VideoAssetEntity.placeholder("u1", "user123", Instant.now());
        asset.setTags(List.of("a", "b"));
        when(repository.findByExternalId("u1")).thenReturn(Optional.of(asset));

        AssetView view = service.getAssetByExternalId("u1");

        assertThat(view.externalId()).isEqualTo("u1");
        assertThat(view.title()).isEqualTo(VideoAssetEntity.PLACEHOLDER_TITLE);
        assertThat(view.tags()).containsExactly("a", "b");
    }

    @Test
    void editAsset_overwritesOnlyProvidedFields() {
        VideoAssetEntity asset = VideoAssetEntity.placeholder("u1", "user123", Instant.now());
        asset.setTitle("My Clip");
        asset.setDescription("keep me");
        asset.setPrivateFlag(true);
        when(repository.findById(1L)).thenReturn(Optional.of(asset));
        when(repository.save(any(VideoAssetEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        AssetView view = service.editAsset(1L, new AssetEditRequest(" Renamed ", null, List.of(" x ", ""), null, false));

        assertThat(view.title()).isEqualTo("Renamed");
        assertThat(view.description()).isEqualTo("keep me");
        assertThat(view.tags()).containsExactly("x");
        assertThat(view.isPrivate()).isFalse();
        assertThat(view.updatedAt()).isNotNull();
    }

    @Test
    void editAsset_blankTitleIsIgnored() {
        VideoAssetEntity asset = VideoAssetEntity.placeholder("u1", "user123", Instant.now());
        asset.setTitle("My Clip");
        when(repository.findById(1L)).thenReturn(Optional.of(asset));
        when(repository.save(any(VideoAssetEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        AssetView view = service.editAsset(1L, new AssetEditRequest("   ", null, null, null, null));

        assertThat(view.title()).isEqualTo("My Clip");
    }

    @Test
    void editAsset_missingRecordThrowsNotFound() {
        when(repository.findById(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.editAsset(1L, new AssetEditRequest("t", null, null, null, null)))
                .isInstanceOf(AssetNotFoundException.class);
        verify(repository, never()).save(any(VideoAssetEntity.class));
    }

    @Test
    void deleteAssetCompletely_withoutDeadlineUsesConfiguredBudget() {
        when(deletionOrchestrator.deleteCompletely(eq(3L), any(Instant.class)))
                .thenReturn(DeletionResult.of(3L, DeletionOutcome.DELETED));
        Instant before = Instant.now();

        DeletionResult result = service.deleteAssetCompletely(3L);

        ArgumentCaptor<Instant> deadline = ArgumentCaptor.forClass(Instant.class);
        verify(deletionOrchestrator).deleteCompletely(eq(3L), deadline.capture());
        assertThat(result.outcome()).isEqualTo(DeletionOutcome.DELETED);
        assertThat(deadline.getValue()).isBetween(before.plusSeconds(20), Instant.now().plusSeconds(20));
    }
}
