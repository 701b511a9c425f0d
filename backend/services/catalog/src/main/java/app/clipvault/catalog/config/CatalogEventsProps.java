package app.clipvault.catalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.catalog.events")
public record CatalogEventsProps(
        Boolean enabled,
        String registeredTopic,
        String finalizedTopic,
        String groupId,
        boolean requeueOnStoreFailure,
        Duration requeueDelay
) {
    public CatalogEventsProps {
        enabled = enabled == null || enabled;
        registeredTopic = blankOr(registeredTopic, "video.uploaded");
        finalizedTopic = blankOr(finalizedTopic, "video.transcoded");
        groupId = blankOr(groupId, "video-catalog");
        if (requeueDelay == null || requeueDelay.isNegative()) {
            requeueDelay = Duration.ofSeconds(5);
        }
    }

    private static String blankOr(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
