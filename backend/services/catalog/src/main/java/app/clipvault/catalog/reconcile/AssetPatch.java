package app.clipvault.catalog.reconcile;

import app.clipvault.catalog.domain.type.AssetStatus;
import app.clipvault.catalog.domain.type.MediaMetadata;
import app.clipvault.catalog.event.AssetFinalizedEvent;
import app.clipvault.catalog.event.AssetRegisteredEvent;
import app.clipvault.catalog.event.TagLists;

import java.util.List;

/**
 * Event-neutral view of what one delivery knows about an asset. Blank strings are absent,
 * tags are canonical, and fields the event type does not carry are {@code null}.
 */
public record AssetPatch(
        String externalId,
        String ownerId,
        String ownerDisplayName,
        String title,
        String description,
        List<String> tags,
        String category,
        Boolean isPrivate,
        String originalFilename,
        String rawObjectPath,
        String manifestUrl,
        String thumbnailUrl,
        MediaMetadata mediaMetadata,
        AssetStatus targetStatus
) {
    public AssetPatch {
        tags = TagLists.normalize(tags);
    }

    public static AssetPatch fromRegistration(AssetRegisteredEvent event) {
        return new AssetPatch(
                clean(event.externalId()),
                clean(event.ownerId()),
                clean(event.ownerDisplayName()),
                clean(event.title()),
                clean(event.description()),
                event.tags(),
                clean(event.category()),
                event.isPrivate(),
                clean(event.originalFilename()),
                clean(event.rawObjectPath()),
                null,
                null,
                null,
                AssetStatus.processing
        );
    }

    public static AssetPatch fromFinalization(AssetFinalizedEvent event) {
        return new AssetPatch(
                clean(event.externalId()),
                clean(event.ownerId()),
                null,
                clean(event.title()),
                clean(event.description()),
                event.tags(),
                clean(event.category()),
                event.isPrivate(),
                clean(event.originalFilename()),
                clean(event.rawObjectPath()),
                clean(event.manifestUrl()),
                clean(event.thumbnailUrl()),
                event.metadata() == null ? null : event.metadata().toMediaMetadata(),
                AssetStatus.ready
        );
    }

    static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
