package net.findmyaisle.support.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeysTest {

    @Test
    void storesKey_isNamespacedByPostalCode() {
        assertThat(CacheKeys.storesKey(" 15213 ")).isEqualTo("stores:zip:15213");
    }

    @Test
    @DisplayName("productsKey hashes every segment and ignores case, whitespace and store order")
    void productsKey_isStableForEquivalentRequests() {
        String first = CacheKeys.productsKey("15213", "Oat Milk", List.of("walmart", "target"), false);
        String second = CacheKeys.productsKey(" 15213 ", "  oat   MILK ", List.of("Target", "walmart", "target"), false);

        assertThat(first).isEqualTo(second);
        assertThat(first).matches("products:zip:[0-9a-f]{64}:q:[0-9a-f]{64}:stores:[0-9a-f]{64}:enh:0");
    }

    @Test
    void productsKey_separatesEnhanceAndStoreSets() {
        String plain = CacheKeys.productsKey("15213", "oat milk", List.of(), false);

        assertThat(CacheKeys.productsKey("15213", "oat milk", List.of(), true)).isNotEqualTo(plain).endsWith(":enh:1");
        assertThat(CacheKeys.productsKey("15213", "oat milk", List.of("aldi"), false)).isNotEqualTo(plain);
        assertThat(CacheKeys.productsKey("15217", "oat milk", List.of(), false)).isNotEqualTo(plain);
    }

    @Test
    void storeSetFingerprint_sortsAndFallsBackToNone() {
        assertThat(CacheKeys.storeSetFingerprint(List.of("walmart", " Aldi ", "walmart"))).isEqualTo("aldi,walmart");
        assertThat(CacheKeys.storeSetFingerprint(null)).isEqualTo(CacheKeys.NO_STORES);
        assertThat(CacheKeys.storeSetFingerprint(List.of(" "))).isEqualTo(CacheKeys.NO_STORES);
    }
}
