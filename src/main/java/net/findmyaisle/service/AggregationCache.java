package net.findmyaisle.service;

import lombok.extern.slf4j.Slf4j;
import net.findmyaisle.exception.CacheOperationException;
import net.findmyaisle.support.cache.CacheStore;
import net.findmyaisle.support.cache.CacheTtl;
import net.findmyaisle.support.cache.JsonPayloadCodec;
import net.findmyaisle.util.LoggingUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * JSON cache for aggregation and store-discovery payloads.
 *
 * <p>Failures never propagate: a broken entry reads as a miss and a failed write is
 * logged and dropped, so callers always fall back to recomputing.</p>
 */
@Slf4j
@Service
public class AggregationCache {

    private final CacheStore store;
    private final JsonPayloadCodec codec;

    public AggregationCache(CacheStore store, JsonPayloadCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    public <T> Optional<T> getJson(String key, Class<T> type) {
        try {
            return store.get(key).map(bytes -> codec.decode(key, bytes, type));
        } catch (CacheOperationException ex) {
            LoggingUtils.warn(log, ex, "Treating unreadable cache entry {} as a miss", key);
            return Optional.empty();
        }
    }

    public void setJson(String key, Object value, Duration ttl) {
        try {
            store.put(key, codec.encode(key, value), ttl);
        } catch (CacheOperationException ex) {
            LoggingUtils.warn(log, ex, "Cache write for {} failed; result is still returned uncached", key);
        }
    }

    public CacheTtl ttlRemaining(String key) {
        try {
            return store.ttl(key);
        } catch (CacheOperationException ex) {
            LoggingUtils.warn(log, ex, "Could not read TTL for {}", key);
            return CacheTtl.missing();
        }
    }

    /**
     * True when the entry still expires and less than {@code ratio} of {@code fullTtl} remains.
     */
    public boolean isNearStale(String key, Duration fullTtl, double ratio) {
        CacheTtl ttl = ttlRemaining(key);
        return ttl.isExpiring()
            && ttl.seconds() > 0
            && ttl.seconds() < fullTtl.toSeconds() * ratio;
    }

    public boolean isEnabled() {
        return store.isEnabled();
    }
}
