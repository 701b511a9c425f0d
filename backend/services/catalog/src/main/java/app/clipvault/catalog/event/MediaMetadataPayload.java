package app.clipvault.catalog.event;

import app.clipvault.catalog.domain.type.MediaMetadata;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MediaMetadataPayload(
        Double duration,
        Long fileSize,
        Integer width,
        Integer height,
        String videoCodec,
        Integer videoBitrate,
        String audioCodec,
        Integer audioBitrate,
        Double frameRate
) {
    public MediaMetadata toMediaMetadata() {
        return new MediaMetadata(
                duration,
                fileSize,
                width,
                height,
                blankToNull(videoCodec),
                videoBitrate,
                blankToNull(audioCodec),
                audioBitrate,
                frameRate
        );
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
