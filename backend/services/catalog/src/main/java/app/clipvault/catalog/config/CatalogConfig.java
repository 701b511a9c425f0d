package app.clipvault.catalog.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({DeletionProps.class, CatalogEventsProps.class})
public class CatalogConfig {
}
