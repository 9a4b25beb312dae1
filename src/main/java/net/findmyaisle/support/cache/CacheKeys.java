package net.findmyaisle.support.cache;

import net.findmyaisle.util.HashUtils;
import net.findmyaisle.util.SearchQueryUtils;

import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Namespaced cache keys. Product key segments are hashed after normalization, and store
 * sets are sorted first, so equivalent requests always produce the same key.
 *
 * <ul>
 *   <li>{@code stores:zip:<postal>}</li>
 *   <li>{@code products:zip:<hash>:q:<hash>:stores:<hash>:enh:<0|1>}</li>
 * </ul>
 */
public final class CacheKeys {

    static final String NO_STORES = "__none__";

    private CacheKeys() {
    }

    public static String storesKey(String postalCode) {
        return "stores:zip:" + normalizePostal(postalCode);
    }

    public static String productsKey(String postalCode, String query, Collection<String> storeIds, boolean enhance) {
        return "products:zip:" + hash(normalizePostal(postalCode))
            + ":q:" + hash(SearchQueryUtils.canonicalize(query))
            + ":stores:" + hash(storeSetFingerprint(storeIds))
            + ":enh:" + (enhance ? "1" : "0");
    }

    static String storeSetFingerprint(Collection<String> storeIds) {
        if (storeIds == null || storeIds.isEmpty()) {
            return NO_STORES;
        }
        List<String> sorted = storeIds.stream()
            .filter(Objects::nonNull)
            .map(id -> id.trim().toLowerCase(Locale.ROOT))
            .filter(id -> !id.isEmpty())
            .distinct()
            .sorted()
            .toList();
        return sorted.isEmpty() ? NO_STORES : String.join(",", sorted);
    }

    private static String normalizePostal(String postalCode) {
        return Objects.requireNonNullElse(postalCode, "").trim();
    }

    private static String hash(String value) {
        try {
            return HashUtils.sha256Hex(value);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
