package net.findmyaisle.support.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process store on Caffeine with a TTL chosen per entry at write time.
 */
public class CaffeineCacheStore implements CacheStore {

    private final Cache<String, StoredEntry> cache;

    public CaffeineCacheStore(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public CaffeineCacheStore(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new PerEntryExpiry())
            .ticker(ticker)
            .recordStats()
            .build();
    }

    @Override
    public Optional<byte[]> get(String key) {
        StoredEntry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.payload());
    }

    @Override
    public void put(String key, byte[] payload, Duration ttl) {
        long ttlNanos = ttl == null || ttl.isZero() || ttl.isNegative() ? StoredEntry.NO_EXPIRY : ttl.toNanos();
        cache.put(key, new StoredEntry(payload, ttlNanos));
    }

    @Override
    public CacheTtl ttl(String key) {
        StoredEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            return CacheTtl.missing();
        }
        if (entry.ttlNanos() == StoredEntry.NO_EXPIRY) {
            return CacheTtl.noExpiry();
        }
        return cache.policy().expireVariably()
            .flatMap(policy -> policy.getExpiresAfter(key))
            .map(remaining -> CacheTtl.expiring(remaining.toSeconds()))
            .orElseGet(CacheTtl::missing);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    record StoredEntry(byte[] payload, long ttlNanos) {
        static final long NO_EXPIRY = Long.MAX_VALUE;
    }

    private static final class PerEntryExpiry implements Expiry<String, StoredEntry> {

        @Override
        public long expireAfterCreate(String key, StoredEntry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, StoredEntry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, StoredEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
