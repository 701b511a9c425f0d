package app.clipvault.catalog.event;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Canonical tag representation: trimmed, non-empty, in the order they were given.
 */
public final class TagLists {
    private static final String DELIMITER = ",";

    private TagLists() {
    }

    public static List<String> split(String delimited) {
        if (delimited == null || delimited.isBlank()) {
            return List.of();
        }
        return normalize(List.of(delimited.split(DELIMITER, -1)));
    }

    public static List<String> normalize(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        List<String> tags = new ArrayList<>(raw.size());
        for (String tag : raw) {
            if (tag == null) {
                continue;
            }
            String trimmed = tag.trim();
            if (!trimmed.isEmpty()) {
                tags.add(trimmed);
            }
        }
        return List.copyOf(tags);
    }
}
