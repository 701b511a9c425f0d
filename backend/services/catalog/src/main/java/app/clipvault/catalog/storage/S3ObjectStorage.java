package app.clipvault.catalog.storage;

import app.clipvault.catalog.config.S3Props;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.time.Duration;

@Component
@ConditionalOnProperty(prefix = "app.s3", name = "enabled", havingValue = "true", matchIfMissing = true)
public class S3ObjectStorage implements ObjectStorage {
    private static final int NOT_FOUND = 404;

    private final S3Client s3Client;
    private final String bucket;

    public S3ObjectStorage(S3Client s3Client, S3Props props) {
        this.s3Client = s3Client;
        this.bucket = props.bucket();
    }

    @Override
    public boolean objectExists(String key, Duration timeout) {
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .overrideConfiguration(timeoutOverride(timeout))
                .build();
        try {
            s3Client.headObject(request);
            return true;
        } catch (NoSuchKeyException ex) {
            return false;
        } catch (S3Exception ex) {
            if (ex.statusCode() == NOT_FOUND) {
                return false;
            }
            throw ex;
        }
    }

    @Override
    public void deleteObject(String key, Duration timeout) {
        DeleteObjectRequest request = DeleteObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .overrideConfiguration(timeoutOverride(timeout))
                .build();
        s3Client.deleteObject(request);
    }

    @Override
    public ObjectListing listObjects(String prefix, String continuationToken, Duration timeout) {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .continuationToken(continuationToken)
                .overrideConfiguration(timeoutOverride(timeout))
                .build();

        ListObjectsV2Response response = s3Client.listObjectsV2(request);
        var keys = response.contents().stream()
                .map(S3Object::key)
                .toList();
        String next = Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
        return new ObjectListing(keys, next);
    }

    private AwsRequestOverrideConfiguration timeoutOverride(Duration timeout) {
        return AwsRequestOverrideConfiguration.builder()
                .apiCallAttemptTimeout(timeout)
                .apiCallTimeout(timeout)
                .build();
    }
}
