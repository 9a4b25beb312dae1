package net.findmyaisle.support.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Byte-level key/value store with per-entry expiry backing the aggregation cache.
 * Backend failures are reported as {@link net.findmyaisle.exception.CacheOperationException}.
 */
public interface CacheStore {

    Optional<byte[]> get(String key);

    /**
     * Stores the payload. A zero or negative {@code ttl} keeps the entry until evicted.
     */
    void put(String key, byte[] payload, Duration ttl);

    CacheTtl ttl(String key);

    boolean isEnabled();
}
