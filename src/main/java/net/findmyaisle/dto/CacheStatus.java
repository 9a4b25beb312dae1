package net.findmyaisle.dto;

/**
 * Whether a response was served from cache, and whether that entry is close to expiry.
 */
public record CacheStatus(boolean hit, boolean nearStale) {

    public static CacheStatus miss() {
        return new CacheStatus(false, false);
    }
}
