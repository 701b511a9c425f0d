package app.clipvault.catalog.deletion;

import app.clipvault.catalog.domain.entity.VideoAssetEntity;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Derives every storage location an asset owns from its catalog row. The row is the only
 * place these paths live, which is why the orchestrator deletes it last.
 */
@Component
public class DeletionPlanner {

    static final String RENDITION_MARKER = "hls";

    public DeletionPlan plan(VideoAssetEntity asset) {
        String owner = asset.getOwnerUserId();
        String externalId = asset.getExternalId();

        List<String> objects = new ArrayList<>();
        if (hasText(asset.getRawObjectPath())) {
            objects.add(stripLeadingSlash(asset.getRawObjectPath().trim()));
        }
        objects.add(thumbnailKey(owner, externalId));

        List<String> prefixes = new ArrayList<>();
        prefixes.add(renditionPrefix(asset.getManifestUrl())
                .orElseGet(() -> folder(RENDITION_MARKER, owner, externalId)));
        prefixes.add(folder("videos", owner, externalId));

        return new DeletionPlan(objects, prefixes);
    }

    static String thumbnailKey(String owner, String externalId) {
        return "thumbnails/" + owner + "/" + externalId + ".jpg";
    }

    /**
     * {@code https://cdn/hls/user123/u1/master.m3u8} yields {@code hls/user123/u1/}.
     */
    static Optional<String> renditionPrefix(String manifestUrl) {
        if (!hasText(manifestUrl)) {
            return Optional.empty();
        }
        String path;
        try {
            path = new URI(manifestUrl.trim()).getPath();
        } catch (URISyntaxException ex) {
            return Optional.empty();
        }
        if (path == null) {
            return Optional.empty();
        }
        List<String> segments = Arrays.stream(path.split("/"))
                .filter(s -> !s.isEmpty())
                .toList();
        int marker = segments.indexOf(RENDITION_MARKER);
        if (marker < 0 || marker + 2 >= segments.size()) {
            return Optional.empty();
        }
        return Optional.of(folder(RENDITION_MARKER, segments.get(marker + 1), segments.get(marker + 2)));
    }

    private static String folder(String root, String owner, String externalId) {
        return root + "/" + owner + "/" + externalId + "/";
    }

    private static String stripLeadingSlash(String key) {
        return key.startsWith("/") ? key.substring(1) : key;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
