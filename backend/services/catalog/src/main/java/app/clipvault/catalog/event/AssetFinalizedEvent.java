package app.clipvault.catalog.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;

/**
 * Published by the transcoding side when renditions, manifest and thumbnail are in place.
 * Descriptive fields are optional and only used to backfill a record whose registration
 * event has not arrived yet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssetFinalizedEvent(
        @JsonProperty("uploadId") String externalId,
        @JsonProperty("userId") String ownerId,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("tags") @JsonDeserialize(using = TagListDeserializer.class) List<String> tags,
        @JsonProperty("category") String category,
        @JsonProperty("isPrivate") Boolean isPrivate,
        @JsonProperty("originalFilename") String originalFilename,
        @JsonProperty("rawVideoPath") String rawObjectPath,
        @JsonProperty("hls") Manifest hls,
        @JsonProperty("thumbnailUrl") String thumbnailUrl,
        @JsonProperty("metadata") MediaMetadataPayload metadata
) {
    public AssetFinalizedEvent {
        tags = tags == null ? List.of() : TagLists.normalize(tags);
    }

    public String manifestUrl() {
        return hls == null ? null : hls.masterUrl();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Manifest(@JsonProperty("masterUrl") String masterUrl) {
    }
}
