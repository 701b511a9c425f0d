package app.clipvault.catalog.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;

/**
 * Published by the upload side once the raw file is stored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssetRegisteredEvent(
        @JsonProperty("uploadId") String externalId,
        @JsonProperty("userId") String ownerId,
        @JsonProperty("username") String ownerDisplayName,
        @JsonProperty("originalFilename") String originalFilename,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("tags") @JsonDeserialize(using = TagListDeserializer.class) List<String> tags,
        @JsonProperty("isPrivate") Boolean isPrivate,
        @JsonProperty("category") String category,
        @JsonProperty("rawVideoPath") String rawObjectPath
) {
    public AssetRegisteredEvent {
        tags = tags == null ? List.of() : TagLists.normalize(tags);
    }
}
