package app.clipvault.catalog.repository;

import app.clipvault.catalog.domain.entity.VideoAssetEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VideoAssetRepository extends JpaRepository<VideoAssetEntity, Long> {
    Optional<VideoAssetEntity> findByExternalId(String externalId);
}
