package net.findmyaisle.support.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Used when caching is switched off: every read misses and writes are dropped.
 */
public class DisabledCacheStore implements CacheStore {

    @Override
    public Optional<byte[]> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, byte[] payload, Duration ttl) {
        // nothing to write to
    }

    @Override
    public CacheTtl ttl(String key) {
        return CacheTtl.missing();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
