package net.findmyaisle.util;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes product brand, name and size strings so that offers for the same item
 * coming from different stores and sources collapse onto one group key.
 *
 * <p>All methods are null-safe and treat {@code null} as the empty string.</p>
 */
public final class ProductNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Filler tokens dropped from product names when surrounded by other words. */
    private static final List<String> NAME_FILLER_TOKENS = List.of("brand", "original", "the");

    /** Unit rewrites, applied in order. */
    private static final List<String[]> SIZE_REWRITES = List.of(
        new String[] {"fluid ounces", "fl oz"},
        new String[] {"fluid ounce", "fl oz"},
        new String[] {"ounces", "oz"},
        new String[] {"ounce", "oz"},
        new String[] {"fl. oz", "fl oz"},
        new String[] {"fl-oz", "fl oz"},
        new String[] {"packs", "pack"},
        new String[] {" ct", " count"},
        new String[] {"ct", " count"}
    );

    private static final String GROUP_KEY_SEPARATOR = "|";

    private ProductNormalizer() {
    }

    public static String normText(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Normalizes a product name. Filler tokens are only removed when they sit between
     * two other words, so "Silk Original" keeps its trailing token while
     * "The Original Oat Milk" loses the inner one.
     */
    public static String normName(String name) {
        String normalized = normText(name);
        for (String token : NAME_FILLER_TOKENS) {
            normalized = normalized.replace(" " + token + " ", " ");
        }
        normalized = normalized.replace('-', ' ');
        return collapseWhitespace(normalized);
    }

    public static String normSize(String size) {
        String normalized = normText(size);
        for (String[] rewrite : SIZE_REWRITES) {
            normalized = normalized.replace(rewrite[0], rewrite[1]);
        }
        return collapseWhitespace(normalized);
    }

    public static String groupKey(String brand, String name, String size) {
        return String.join(GROUP_KEY_SEPARATOR, normText(brand), normName(name), normSize(size));
    }

    private static String collapseWhitespace(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }
}
