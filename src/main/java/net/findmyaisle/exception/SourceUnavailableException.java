package net.findmyaisle.exception;

/**
 * A single upstream call failed. Raised by the source clients and absorbed per store
 * by the aggregation pipeline; never surfaced to HTTP callers.
 */
public class SourceUnavailableException extends RuntimeException {

    public enum Reason {
        TIMEOUT,
        AUTHENTICATION,
        RATE_LIMITED,
        MALFORMED_PAYLOAD,
        UPSTREAM_ERROR
    }

    private final String sourceName;
    private final Reason reason;

    public SourceUnavailableException(String sourceName, Reason reason, String message) {
        this(sourceName, reason, message, null);
    }

    public SourceUnavailableException(String sourceName, Reason reason, String message, Throwable cause) {
        super(sourceName + " unavailable (" + reason + "): " + message, cause);
        this.sourceName = sourceName;
        this.reason = reason;
    }

    public String getSourceName() {
        return sourceName;
    }

    public Reason getReason() {
        return reason;
    }
}
