package net.findmyaisle.exception;

/**
 * Request rejected before any cache or source is touched (bad postal code, empty query).
 * Mapped to HTTP 400.
 */
public class InvalidAggregationRequestException extends RuntimeException {
    public InvalidAggregationRequestException(String message) {
        super(message);
    }
}
