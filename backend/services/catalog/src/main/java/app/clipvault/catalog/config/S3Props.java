package app.clipvault.catalog.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Object store holding raw uploads, HLS renditions and thumbnails. Bound only while
 * {@code enabled} is true, so the connection settings are required whenever it is.
 */
@Validated
@ConfigurationProperties(prefix = "app.s3")
public record S3Props(
        Boolean enabled,
        @NotBlank String bucket,
        @NotBlank String region,
        @NotBlank String endpoint,
        boolean pathStyleAccess,
        @NotBlank String accessKey,
        @NotBlank String secretKey
) {
    public S3Props {
        enabled = enabled == null || enabled;
    }
}
