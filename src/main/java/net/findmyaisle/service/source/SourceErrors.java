package net.findmyaisle.service.source;

import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import net.findmyaisle.exception.SourceUnavailableException;
import net.findmyaisle.exception.SourceUnavailableException.Reason;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import tools.jackson.core.JacksonException;

import java.util.concurrent.TimeoutException;

/**
 * Maps transport and HTTP failures onto {@link SourceUnavailableException} reasons.
 */
final class SourceErrors {

    private SourceErrors() {
    }

    static SourceUnavailableException classify(String sourceName, Throwable error) {
        if (error instanceof SourceUnavailableException unavailable) {
            return unavailable;
        }
        if (error instanceof TimeoutException) {
            return new SourceUnavailableException(sourceName, Reason.TIMEOUT, "no answer in time", error);
        }
        if (error instanceof RequestNotPermitted) {
            return new SourceUnavailableException(sourceName, Reason.RATE_LIMITED, "local rate limit reached", error);
        }
        if (error instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            Reason reason = switch (status) {
                case 401, 403 -> Reason.AUTHENTICATION;
                case 429 -> Reason.RATE_LIMITED;
                default -> Reason.UPSTREAM_ERROR;
            };
            return new SourceUnavailableException(sourceName, reason, "HTTP " + status, error);
        }
        if (error instanceof DecodingException || error instanceof JacksonException) {
            return new SourceUnavailableException(sourceName, Reason.MALFORMED_PAYLOAD, "unreadable response body", error);
        }
        return new SourceUnavailableException(sourceName, Reason.UPSTREAM_ERROR,
            error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName(), error);
    }
}
