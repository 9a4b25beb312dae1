package net.findmyaisle.service.source;

import net.findmyaisle.model.RawSourceResponse;
import reactor.core.publisher.Mono;

/**
 * Free-text answer source queried once per store.
 *
 * <p>Every failure (timeout, rejected credentials, rate limit, unreadable payload)
 * is signalled as {@link net.findmyaisle.exception.SourceUnavailableException}.</p>
 */
public interface PrimarySourceClient {

    String name();

    /**
     * @return false when no credentials are configured; calls would then fail
     */
    boolean isConfigured();

    Mono<RawSourceResponse> query(String prompt);
}
