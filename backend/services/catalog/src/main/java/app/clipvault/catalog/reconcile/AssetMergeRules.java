package app.clipvault.catalog.reconcile;

import app.clipvault.catalog.domain.entity.VideoAssetEntity;
import app.clipvault.catalog.domain.type.AssetStatus;
import app.clipvault.catalog.domain.type.MediaMetadata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;

import static app.clipvault.catalog.reconcile.FieldPolicy.AUTHORITATIVE;
import static app.clipvault.catalog.reconcile.FieldPolicy.FILL_IF_EMPTY;

/**
 * Field table for merging an {@link AssetPatch} into a catalog record. Each field has exactly
 * one policy, and the policy is the same whichever event the patch came from.
 */
public final class AssetMergeRules {

    private static final Predicate<String> BLANK = value -> value == null || value.isBlank();
    private static final Predicate<String> BLANK_OR_PLACEHOLDER =
            value -> BLANK.test(value) || VideoAssetEntity.PLACEHOLDER_TITLE.equals(value);
    private static final Predicate<Collection<?>> NO_ELEMENTS = value -> value == null || value.isEmpty();
    private static final Predicate<MediaMetadata> NO_METADATA = value -> value == null || value.isEmpty();

    private static final List<FieldRule<?>> RULES = List.of(
            rule("ownerUserId", VideoAssetEntity::getOwnerUserId, VideoAssetEntity::setOwnerUserId,
                    AssetPatch::ownerId, FieldMerge.reducer(FILL_IF_EMPTY, BLANK)),
            rule("ownerDisplayName", VideoAssetEntity::getOwnerDisplayName, VideoAssetEntity::setOwnerDisplayName,
                    AssetPatch::ownerDisplayName, FieldMerge.reducer(FILL_IF_EMPTY, BLANK)),
            rule("title", VideoAssetEntity::getTitle, VideoAssetEntity::setTitle,
                    AssetPatch::title, FieldMerge.reducer(FILL_IF_EMPTY, BLANK_OR_PLACEHOLDER)),
            rule("description", VideoAssetEntity::getDescription, VideoAssetEntity::setDescription,
                    AssetPatch::description, FieldMerge.reducer(FILL_IF_EMPTY, BLANK)),
            rule("tags", VideoAssetEntity::getTags, VideoAssetEntity::setTags,
                    AssetPatch::tags, FieldMerge.<List<String>>reducer(FILL_IF_EMPTY, NO_ELEMENTS)),
            rule("category", VideoAssetEntity::getCategory, VideoAssetEntity::setCategory,
                    AssetPatch::category, FieldMerge.reducer(FILL_IF_EMPTY, BLANK)),
            rule("originalFileName", VideoAssetEntity::getOriginalFileName, VideoAssetEntity::setOriginalFileName,
                    AssetPatch::originalFilename, FieldMerge.reducer(FILL_IF_EMPTY, BLANK)),
            rule("rawObjectPath", VideoAssetEntity::getRawObjectPath, VideoAssetEntity::setRawObjectPath,
                    AssetPatch::rawObjectPath, FieldMerge.reducer(FILL_IF_EMPTY, BLANK)),
            rule("thumbnailUrl", VideoAssetEntity::getThumbnailUrl, VideoAssetEntity::setThumbnailUrl,
                    AssetPatch::thumbnailUrl, FieldMerge.reducer(FILL_IF_EMPTY, BLANK)),
            rule("privateFlag", VideoAssetEntity::isPrivateFlag, VideoAssetEntity::setPrivateFlag,
                    AssetPatch::isPrivate, FieldMerge.escalateOnly()),
            rule("manifestUrl", VideoAssetEntity::getManifestUrl, VideoAssetEntity::setManifestUrl,
                    AssetPatch::manifestUrl, FieldMerge.reducer(AUTHORITATIVE, BLANK)),
            rule("mediaMetadata", VideoAssetEntity::getMediaMetadata, VideoAssetEntity::setMediaMetadata,
                    AssetPatch::mediaMetadata, FieldMerge.reducer(AUTHORITATIVE, NO_METADATA)),
            rule("status", VideoAssetEntity::getStatus, VideoAssetEntity::setStatus,
                    AssetPatch::targetStatus, AssetStatus::advance)
    );

    private AssetMergeRules() {
    }

    /**
     * Applies every field rule and returns the names of the fields whose value changed.
     */
    public static List<String> apply(VideoAssetEntity entity, AssetPatch patch) {
        List<String> changed = new ArrayList<>();
        for (FieldRule<?> rule : RULES) {
            if (rule.apply(entity, patch)) {
                changed.add(rule.name());
            }
        }
        return changed;
    }

    private static <T> FieldRule<T> rule(String name,
                                         Function<VideoAssetEntity, T> current,
                                         BiConsumer<VideoAssetEntity, T> setter,
                                         Function<AssetPatch, T> incoming,
                                         BinaryOperator<T> reducer) {
        return new FieldRule<>(name, current, setter, incoming, reducer);
    }

    private record FieldRule<T>(
            String name,
            Function<VideoAssetEntity, T> current,
            BiConsumer<VideoAssetEntity, T> setter,
            Function<AssetPatch, T> incoming,
            BinaryOperator<T> reducer
    ) {
        boolean apply(VideoAssetEntity entity, AssetPatch patch) {
            T existing = current.apply(entity);
            T merged = reducer.apply(existing, incoming.apply(patch));
            if (Objects.equals(existing, merged)) {
                return false;
            }
            setter.accept(entity, merged);
            return true;
        }
    }
}
