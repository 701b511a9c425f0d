package app.clipvault.catalog.repository;

import app.clipvault.catalog.domain.entity.VideoAssetEntity;
import app.clipvault.catalog.domain.type.AssetStatus;
import app.clipvault.catalog.domain.type.MediaMetadata;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Testcontainers(disabledWithoutDocker = true)
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class VideoAssetRepositoryDataJpaTest {

    @Container
    private static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DockerImageName.parse("postgres:16"))
                    .withDatabaseName("clipvault_catalog")
                    .withUsername("clipvault")
                    .withPassword("clipvault");

    @DynamicPropertySource
    static void dataSourceProps(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    VideoAssetRepository repository;

    @Autowired
    TestEntityManager entityManager;

    @Test
    void findByExternalId_roundTripsTagsAndMetadata() {
        VideoAssetEntity asset = VideoAssetEntity.placeholder("ext-1", "user123", Instant.now());
        asset.setTags(List.of("a", "b"));
        asset.setStatus(AssetStatus.ready);
        asset.setMediaMetadata(new MediaMetadata(12.5, 2048L, 1920, 1080, "h264", 4500, "aac", 128, 29.97));
        repository.saveAndFlush(asset);
        entityManager.clear();

        VideoAssetEntity loaded = repository.findByExternalId("ext-1").orElseThrow();

        assertThat(loaded.getAssetId()).isNotNull();
        assertThat(loaded.getTags()).containsExactly("a", "b");
        assertThat(loaded.getStatus()).isEqualTo(AssetStatus.ready);
        assertThat(loaded.getMediaMetadata().durationSeconds()).isEqualTo(12.5);
        assertThat(loaded.getTitle()).isEqualTo(VideoAssetEntity.PLACEHOLDER_TITLE);
    }

    @Test
    void externalIdIsUnique() {
        repository.saveAndFlush(VideoAssetEntity.placeholder("dup-1", "user123", Instant.now()));

        assertThatThrownBy(() -> repository.saveAndFlush(VideoAssetEntity.placeholder("dup-1", "user456", Instant.now())))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void updatesBumpVersion() {
        VideoAssetEntity asset = repository.saveAndFlush(VideoAssetEntity.placeholder("ver-1", "user123", Instant.now()));
        long initial = asset.getVersion();

        asset.setTitle("Renamed");
        repository.saveAndFlush(asset);

        assertThat(asset.getVersion()).isEqualTo(initial + 1);
    }

    @Test
    void findByExternalId_absentIsEmpty() {
        assertThat(repository.findByExternalId("missing")).isEmpty();
    }
}
