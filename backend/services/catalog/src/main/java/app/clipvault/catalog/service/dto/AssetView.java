package app.clipvault.catalog.service.dto;

import app.clipvault.catalog.domain.entity.VideoAssetEntity;
import app.clipvault.catalog.domain.type.AssetStatus;
import app.clipvault.catalog.domain.type.MediaMetadata;

import java.time.Instant;
import java.util.List;

public record AssetView(
        Long assetId,
        String externalId,
        String ownerUserId,
        String ownerDisplayName,
        String title,
        String description,
        List<String> tags,
        String category,
        boolean isPrivate,
        AssetStatus status,
        String originalFileName,
        String manifestUrl,
        String thumbnailUrl,
        MediaMetadata mediaMetadata,
        Instant createdAt,
        Instant updatedAt
) {
    public static AssetView from(VideoAssetEntity entity) {
        return new AssetView(
                entity.getAssetId(),
                entity.getExternalId(),
                entity.getOwnerUserId(),
                entity.getOwnerDisplayName(),
                entity.getTitle(),
                entity.getDescription(),
                entity.getTags(),
                entity.getCategory(),
                entity.isPrivateFlag(),
                entity.getStatus(),
                entity.getOriginalFileName(),
                entity.getManifestUrl(),
                entity.getThumbnailUrl(),
                entity.getMediaMetadata(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}
