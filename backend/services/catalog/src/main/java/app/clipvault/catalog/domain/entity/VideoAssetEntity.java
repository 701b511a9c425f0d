package app.clipvault.catalog.domain.entity;

import app.clipvault.catalog.domain.type.AssetStatus;
import app.clipvault.catalog.domain.type.MediaMetadata;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

@Entity
@Table(name = "video_assets", schema = "app_catalog")
public class VideoAssetEntity {

    public static final String PLACEHOLDER_TITLE = "Untitled Video";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "asset_id", nullable = false, updatable = false)
    private Long assetId;

    @Column(name = "external_id", nullable = false, updatable = false, unique = true)
    private String externalId;

    @Column(name = "owner_user_id", nullable = false)
    private String ownerUserId;

    @Column(name = "owner_display_name")
    private String ownerDisplayName;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "description")
    private String description;

    @Column(name = "category")
    private String category;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "tags", columnDefinition = "text[]")
    private String[] tags;

    @Column(name = "is_private", nullable = false)
    private boolean privateFlag;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private AssetStatus status;

    @Column(name = "original_file_name")
    private String originalFileName;

    @Column(name = "raw_object_path")
    private String rawObjectPath;

    @Column(name = "manifest_url")
    private String manifestUrl;

    @Column(name = "thumbnail_url")
    private String thumbnailUrl;

    @Column(name = "duration_seconds")
    private Double durationSeconds;

    @Column(name = "file_size_bytes")
    private Long fileSizeBytes;

    @Column(name = "width")
    private Integer width;

    @Column(name = "height")
    private Integer height;

    @Column(name = "video_codec")
    private String videoCodec;

    @Column(name = "video_bitrate")
    private Integer videoBitrate;

    @Column(name = "audio_codec")
    private String audioCodec;

    @Column(name = "audio_bitrate")
    private Integer audioBitrate;

    @Column(name = "frame_rate")
    private Double frameRate;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected VideoAssetEntity() {
    }

    /**
     * Minimal row for an asset seen for the first time; the triggering event fills the rest.
     */
    public static VideoAssetEntity placeholder(String externalId, String ownerUserId, Instant now) {
        VideoAssetEntity entity = new VideoAssetEntity();
        entity.externalId = externalId;
        entity.ownerUserId = ownerUserId;
        entity.title = PLACEHOLDER_TITLE;
        entity.tags = new String[0];
        entity.privateFlag = false;
        entity.status = AssetStatus.registered;
        entity.createdAt = now;
        return entity;
    }

    public Long getAssetId() {
        return assetId;
    }

    public String getExternalId() {
        return externalId;
    }

    public String getOwnerUserId() {
        return ownerUserId;
    }

    public void setOwnerUserId(String ownerUserId) {
        this.ownerUserId = ownerUserId;
    }

    public String getOwnerDisplayName() {
        return ownerDisplayName;
    }

    public void setOwnerDisplayName(String ownerDisplayName) {
        this.ownerDisplayName = ownerDisplayName;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public List<String> getTags() {
        return tags == null ? List.of() : List.copyOf(Arrays.asList(tags));
    }

    public void setTags(List<String> tags) {
        this.tags = tags == null ? new String[0] : tags.toArray(new String[0]);
    }

    public boolean isPrivateFlag() {
        return privateFlag;
    }

    public void setPrivateFlag(boolean privateFlag) {
        this.privateFlag = privateFlag;
    }

    public AssetStatus getStatus() {
        return status;
    }

    public void setStatus(AssetStatus status) {
        this.status = status;
    }

    public String getOriginalFileName() {
        return originalFileName;
    }

    public void setOriginalFileName(String originalFileName) {
        this.originalFileName = originalFileName;
    }

    public String getRawObjectPath() {
        return rawObjectPath;
    }

    public void setRawObjectPath(String rawObjectPath) {
        this.rawObjectPath = rawObjectPath;
    }

    public String getManifestUrl() {
        return manifestUrl;
    }

    public void setManifestUrl(String manifestUrl) {
        this.manifestUrl = manifestUrl;
    }

    public String getThumbnailUrl() {
        return thumbnailUrl;
    }

    public void setThumbnailUrl(String thumbnailUrl) {
        this.thumbnailUrl = thumbnailUrl;
    }

    public MediaMetadata getMediaMetadata() {
        return new MediaMetadata(
                durationSeconds,
                fileSizeBytes,
                width,
                height,
                videoCodec,
                videoBitrate,
                audioCodec,
                audioBitrate,
                frameRate
        );
    }

    public void setMediaMetadata(MediaMetadata metadata) {
        this.durationSeconds = metadata.durationSeconds();
        this.fileSizeBytes = metadata.fileSizeBytes();
        this.width = metadata.width();
        this.height = metadata.height();
        this.videoCodec = metadata.videoCodec();
        this.videoBitrate = metadata.videoBitrate();
        this.audioCodec = metadata.audioCodec();
        this.audioBitrate = metadata.audioBitrate();
        this.frameRate = metadata.frameRate();
    }

    public long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
