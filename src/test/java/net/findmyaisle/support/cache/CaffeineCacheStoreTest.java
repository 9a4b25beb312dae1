package net.findmyaisle.support.cache;

import net.findmyaisle.testutil.FakeTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CaffeineCacheStoreTest {

    private FakeTicker ticker;
    private CaffeineCacheStore store;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        store = new CaffeineCacheStore(100, ticker);
    }

    @Test
    void ttl_reportsRemainingSecondsForExpiringEntry() {
        store.put("products:a", bytes("payload"), Duration.ofHours(4));
        ticker.advance(Duration.ofHours(1));

        CacheTtl ttl = store.ttl("products:a");

        assertThat(ttl.isExpiring()).isTrue();
        assertThat(ttl.seconds()).isEqualTo(Duration.ofHours(3).toSeconds());
        assertThat(store.get("products:a")).hasValueSatisfying(value ->
            assertThat(new String(value, StandardCharsets.UTF_8)).isEqualTo("payload"));
    }

    @Test
    void get_missesOnceTtlHasElapsed() {
        store.put("stores:zip:15213", bytes("payload"), Duration.ofMinutes(10));
        ticker.advance(Duration.ofMinutes(11));

        assertThat(store.get("stores:zip:15213")).isEmpty();
        assertThat(store.ttl("stores:zip:15213").state()).isEqualTo(CacheTtl.State.MISSING);
    }

    @Test
    void put_withoutPositiveTtlNeverExpires() {
        store.put("forever", bytes("payload"), Duration.ZERO);
        ticker.advance(Duration.ofDays(365));

        assertThat(store.get("forever")).isPresent();
        assertThat(store.ttl("forever")).isEqualTo(CacheTtl.noExpiry());
    }

    @Test
    void put_overwritesEntryAndItsTtl() {
        store.put("key", bytes("old"), Duration.ofMinutes(1));
        store.put("key", bytes("new"), Duration.ofHours(2));
        ticker.advance(Duration.ofMinutes(30));

        assertThat(store.get("key")).hasValueSatisfying(value ->
            assertThat(new String(value, StandardCharsets.UTF_8)).isEqualTo("new"));
        assertThat(store.ttl("key").seconds()).isEqualTo(Duration.ofMinutes(90).toSeconds());
    }

    @Test
    void ttl_isMissingForUnknownKey() {
        assertThat(store.ttl("nope")).isEqualTo(CacheTtl.missing());
        assertThat(store.isEnabled()).isTrue();
    }

    @Test
    void disabledStore_alwaysMisses() {
        DisabledCacheStore disabled = new DisabledCacheStore();
        disabled.put("key", bytes("payload"), Duration.ofHours(1));

        assertThat(disabled.get("key")).isEmpty();
        assertThat(disabled.ttl("key").state()).isEqualTo(CacheTtl.State.MISSING);
        assertThat(disabled.isEnabled()).isFalse();
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
