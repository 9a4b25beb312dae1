package net.findmyaisle.support.cache;

/**
 * Remaining lifetime of a cache entry.
 *
 * @param state whether the entry exists and expires
 * @param seconds remaining seconds, only meaningful for {@link State#EXPIRING}
 */
public record CacheTtl(State state, long seconds) {

    public enum State {
        EXPIRING,
        NO_EXPIRY,
        MISSING
    }

    public static CacheTtl expiring(long seconds) {
        return new CacheTtl(State.EXPIRING, Math.max(0, seconds));
    }

    public static CacheTtl noExpiry() {
        return new CacheTtl(State.NO_EXPIRY, -1);
    }

    public static CacheTtl missing() {
        return new CacheTtl(State.MISSING, -2);
    }

    public boolean isExpiring() {
        return state == State.EXPIRING;
    }
}
