package net.findmyaisle.exception;

/**
 * Serialization or storage of a cached payload failed.
 */
public class CacheOperationException extends RuntimeException {
    public CacheOperationException(String key, String operation, Throwable cause) {
        super("Cache " + operation + " failed for key " + key, cause);
    }
}
