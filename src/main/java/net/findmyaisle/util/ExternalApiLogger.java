package net.findmyaisle.util;

import org.slf4j.Logger;

/**
 * Centralized console logging for upstream source calls and aggregation runs.
 *
 * These logs help debug the per-store fan-out:
 * - Sonar (primary, free text)
 * - Serper shopping (secondary, structured rows)
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String subject) {
        String message = String.format("%s [%s] ATTEMPT: %s for '%s'",
            PREFIX, apiName, operation, subject);
        log.info(message);
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String subject, int resultCount) {
        String message = String.format("%s [%s] SUCCESS: %s returned %d result(s) for '%s'",
            PREFIX, apiName, operation, resultCount, subject);
        log.info(message);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String subject, String reason) {
        String message = String.format("%s [%s] FAILURE: %s failed for '%s' - %s",
            PREFIX, apiName, operation, subject, reason);
        log.warn(message);
    }

    /**
     * Log a call skipped because the source has no credentials
     */
    public static void logSourceDisabled(Logger log, String apiName, String subject) {
        String message = String.format("%s [%s] DISABLED: no API key configured, skipping '%s'",
            PREFIX, apiName, subject);
        log.debug(message);
    }

    /**
     * Log the switch from the primary to the secondary source for one store
     */
    public static void logSecondaryFallback(Logger log, String storeId, String query, String reason) {
        String message = String.format("%s [FALLBACK] store='%s' query='%s' - %s",
            PREFIX, storeId, query, reason);
        log.info(message);
    }

    /**
     * Log the start of an aggregation run
     */
    public static void logAggregationStart(Logger log, String query, String postalCode, int storeCount) {
        String message = String.format("%s [AGGREGATE] START: query='%s', postalCode=%s, stores=%d",
            PREFIX, query, postalCode, storeCount);
        log.info(message);
    }

    /**
     * Log the completion of an aggregation run
     */
    public static void logAggregationComplete(Logger log, String query, String postalCode, int productCount, int offerCount) {
        String message = String.format("%s [AGGREGATE] COMPLETE: query='%s', postalCode=%s, products=%d, offers=%d",
            PREFIX, query, postalCode, productCount, offerCount);
        log.info(message);
    }
}
