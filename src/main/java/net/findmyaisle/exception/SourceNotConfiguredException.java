package net.findmyaisle.exception;

/**
 * A required upstream source has no credentials. Mapped to HTTP 503.
 */
public class SourceNotConfiguredException extends RuntimeException {

    private final String sourceName;

    public SourceNotConfiguredException(String sourceName) {
        super(sourceName + " source is not configured");
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
