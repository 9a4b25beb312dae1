package net.findmyaisle.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Utility methods for working with product queries and store lists.
 * Centralizes common normalization behavior so controllers, services
 * and cache keys stay aligned.
 */
public final class SearchQueryUtils {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LIST_SEPARATOR = Pattern.compile(",");

    private SearchQueryUtils() {
        // Utility class
    }

    /**
     * Produces a canonical, case-insensitive representation suitable for
     * cache lookups: lowercased, trimmed, inner whitespace collapsed.
     * Returns an empty string for {@code null}.
     */
    public static String canonicalize(String query) {
        if (query == null) {
            return "";
        }
        return WHITESPACE.matcher(query.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    /**
     * Splits a comma separated store list into lowercased, trimmed identifiers.
     * Blank entries and repeats are dropped; caller order is kept.
     */
    public static List<String> parseStoreList(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (String part : LIST_SEPARATOR.split(csv)) {
            String id = part.trim().toLowerCase(Locale.ROOT);
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return new ArrayList<>(ids);
    }
}
