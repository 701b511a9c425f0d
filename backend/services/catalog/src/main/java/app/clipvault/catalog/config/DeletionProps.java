package app.clipvault.catalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * @param catalogOnlyFallback when the object store is disabled, delete the catalog row anyway
 *                            and leave its storage objects behind
 * @param defaultDeadline     time budget for a deletion whose caller gave none
 */
@ConfigurationProperties(prefix = "app.catalog.deletion")
public record DeletionProps(
        boolean catalogOnlyFallback,
        Duration defaultDeadline
) {
    public DeletionProps {
        if (defaultDeadline == null || defaultDeadline.isZero() || defaultDeadline.isNegative()) {
            defaultDeadline = Duration.ofSeconds(30);
        }
    }
}
