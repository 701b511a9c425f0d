package app.clipvault.catalog.service.dto;

import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Owner edit of descriptive fields. A {@code null} field is left as stored.
 */
public record AssetEditRequest(
        @Size(max = 255) String title,
        @Size(max = 5000) String description,
        List<@Size(max = 64) String> tags,
        @Size(max = 64) String category,
        Boolean isPrivate
) {
}
