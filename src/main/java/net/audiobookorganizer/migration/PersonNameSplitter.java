package net.audiobookorganizer.migration;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits combined credit strings such as {@code "Terry Pratchett & Neil Gaiman"}.
 */
final class PersonNameSplitter {

    static final String SEPARATOR = "&";

    private PersonNameSplitter() {
    }

    static boolean isCombined(String name) {
        return name != null && name.contains(SEPARATOR);
    }

    /** Trimmed, non-empty parts in their original order. */
    static List<String> split(String name) {
        List<String> parts = new ArrayList<>();
        if (name == null) {
            return parts;
        }
        for (String part : name.split(SEPARATOR)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }
}
