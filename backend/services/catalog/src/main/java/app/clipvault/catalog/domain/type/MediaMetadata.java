package app.clipvault.catalog.domain.type;

/**
 * Technical description of the transcoded rendition, reported by the finalization event.
 */
public record MediaMetadata(
        Double durationSeconds,
        Long fileSizeBytes,
        Integer width,
        Integer height,
        String videoCodec,
        Integer videoBitrate,
        String audioCodec,
        Integer audioBitrate,
        Double frameRate
) {
    public boolean isEmpty() {
        return durationSeconds == null
                && fileSizeBytes == null
                && width == null
                && height == null
                && videoCodec == null
                && videoBitrate == null
                && audioCodec == null
                && audioBitrate == null
                && frameRate == null;
    }
}
