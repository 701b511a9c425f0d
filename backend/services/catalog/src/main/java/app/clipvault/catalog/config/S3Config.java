package app.clipvault.catalog.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

/**
 * Object store wiring. With {@code app.s3.enabled=false} none of these beans exist and
 * deletion falls back to the mode chosen in {@link DeletionProps}.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.s3", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties({S3Props.class, StorageResilienceProps.class})
public class S3Config {

    @Bean
    public S3Client s3Client(S3Props p) {
        var creds = AwsBasicCredentials.create(p.accessKey(), p.secretKey());

        var s3Config = S3Configuration.builder()
                .pathStyleAccessEnabled(p.pathStyleAccess())
                .build();

        return S3Client.builder()
                .region(Region.of(p.region()))
                .endpointOverride(URI.create(p.endpoint()))
                .credentialsProvider(StaticCredentialsProvider.create(creds))
                .serviceConfiguration(s3Config)
                // ResilientStorageGateway is the only retry layer
                .overrideConfiguration(o -> o.retryPolicy(RetryPolicy.none()))
                .build();
    }
}
