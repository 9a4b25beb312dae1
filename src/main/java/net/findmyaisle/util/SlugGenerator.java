package net.findmyaisle.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives stable store identifiers from free-text store names.
 * Identifiers are lowercase, underscore separated and safe to embed in cache keys.
 */
public final class SlugGenerator {
    private static final Pattern SEPARATORS = Pattern.compile("[\\s-]+");
    private static final Pattern NON_ID_CHARS = Pattern.compile("[^a-z0-9_]");
    private static final Pattern MULTIPLE_UNDERSCORES = Pattern.compile("_{2,}");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    private SlugGenerator() {}

    /**
     * Convert a store name to its identifier.
     * Example: "Trader Joe's" becomes "trader_joes", "Stop & Shop" becomes "stop_and_shop".
     * Applying it to its own output returns the same value.
     *
     * @param storeName display name as returned by a source, may be null
     * @return identifier, or an empty string when nothing usable remains
     */
    public static String storeId(String storeName) {
        if (storeName == null) {
            return "";
        }

        String slug = storeName.toLowerCase(Locale.ROOT).trim();

        // Strip accents (é -> e)
        slug = Normalizer.normalize(slug, Normalizer.Form.NFD);
        slug = slug.replaceAll("[\\p{InCombiningDiacriticalMarks}]", "");

        slug = slug.replace("&", " and ");
        slug = slug.replace("'", "");
        slug = slug.replace("’", "");

        slug = SEPARATORS.matcher(slug).replaceAll("_");
        slug = NON_ID_CHARS.matcher(slug).replaceAll("");
        slug = MULTIPLE_UNDERSCORES.matcher(slug).replaceAll("_");
        slug = EDGE_UNDERSCORES.matcher(slug).replaceAll("");

        return slug;
    }

    /**
     * Turn an identifier back into a readable name, e.g. "giant_eagle" becomes "Giant Eagle".
     */
    public static String titleCase(String storeId) {
        if (storeId == null || storeId.isBlank()) {
            return "";
        }
        String[] words = storeId.trim().split("_+");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}
