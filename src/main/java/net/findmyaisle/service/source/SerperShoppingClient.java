/**
 * Secondary source client for Serper's Google Shopping search.
 *
 * <p>Queries are scoped with {@code site:<domain>} when the store has a configured
 * shopping domain, and rows linking elsewhere are dropped.</p>
 */
package net.findmyaisle.service.source;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import net.findmyaisle.config.AggregationProperties;
import net.findmyaisle.exception.SourceNotConfiguredException;
import net.findmyaisle.exception.SourceUnavailableException;
import net.findmyaisle.model.ProductRecord;
import net.findmyaisle.model.StoreRef;
import net.findmyaisle.util.ExternalApiLogger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class SerperShoppingClient implements SecondarySourceClient {

    static final String SOURCE_NAME = "Serper";

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final AggregationProperties aggregationProperties;
    private final String apiKey;
    private final int resultCount;
    private final Duration requestTimeout;

    public SerperShoppingClient(WebClient.Builder webClientBuilder,
                                @Qualifier("serperRateLimiter") RateLimiter rateLimiter,
                                AggregationProperties aggregationProperties,
                                @Value("${sources.serper.base-url:https://google.serper.dev}") String baseUrl,
                                @Value("${sources.serper.api-key:}") String apiKey,
                                @Value("${sources.serper.result-count:20}") int resultCount,
                                @Value("${sources.serper.request-timeout:15s}") Duration requestTimeout) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.rateLimiter = rateLimiter;
        this.aggregationProperties = aggregationProperties;
        this.apiKey = apiKey;
        this.resultCount = resultCount;
        this.requestTimeout = requestTimeout;
        if (!isConfigured()) {
            log.warn("Serper shopping fallback disabled: sources.serper.api-key is not set");
        }
    }

    @Override
    public String name() {
        return SOURCE_NAME;
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.hasText(apiKey);
    }

    @Override
    public Mono<List<ProductRecord>> searchShopping(String query, StoreRef store, String locationHint) {
        Optional<String> domain = store == null ? Optional.empty() : aggregationProperties.domainFor(store.storeId());
        String searchQuery = domain.map(d -> query + " site:" + d).orElse(query);
        if (!isConfigured()) {
            ExternalApiLogger.logSourceDisabled(log, SOURCE_NAME, searchQuery);
            return Mono.error(new SourceNotConfiguredException(SOURCE_NAME));
        }
        return webClient.post()
                .uri("/search")
                .header("X-API-KEY", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody(searchQuery, locationHint))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .doOnSubscribe(s -> ExternalApiLogger.logApiCallAttempt(log, SOURCE_NAME, "SHOPPING_SEARCH", searchQuery))
                .timeout(requestTimeout)
                .transformDeferred(RateLimiterOperator.of(rateLimiter))
                .map(body -> ShoppingResultParser.parse(body, domain.orElse(null)))
                .defaultIfEmpty(List.of())
                .doOnSuccess(rows -> ExternalApiLogger.logApiCallSuccess(log, SOURCE_NAME, "SHOPPING_SEARCH", searchQuery,
                        rows == null ? 0 : rows.size()))
                .onErrorMap(e -> {
                    SourceUnavailableException classified = SourceErrors.classify(SOURCE_NAME, e);
                    ExternalApiLogger.logApiCallFailure(log, SOURCE_NAME, "SHOPPING_SEARCH", searchQuery,
                            classified.getReason().name());
                    return classified;
                });
    }

    private Map<String, Object> requestBody(String searchQuery, String locationHint) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("q", searchQuery);
        body.put("gl", "us");
        body.put("hl", "en");
        body.put("num", resultCount);
        body.put("type", "shopping");
        if (StringUtils.hasText(locationHint)) {
            body.put("location", locationHint);
        }
        return body;
    }
}
