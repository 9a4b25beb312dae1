/**
 * Primary source client for the Perplexity Sonar chat-completions API.
 *
 * <p>Sends one free-text prompt per call and returns the answer text together with
 * the citation URLs and search results the API reports, for later URL enrichment.</p>
 */
package net.findmyaisle.service.source;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import net.findmyaisle.exception.SourceNotConfiguredException;
import net.findmyaisle.exception.SourceUnavailableException;
import net.findmyaisle.exception.SourceUnavailableException.Reason;
import net.findmyaisle.model.RawSourceResponse;
import net.findmyaisle.model.RelatedResult;
import net.findmyaisle.util.ExternalApiLogger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class SonarSourceClient implements PrimarySourceClient {

    static final String SOURCE_NAME = "Sonar";
    private static final int PROMPT_PREVIEW_LENGTH = 60;

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final double temperature;
    private final Duration requestTimeout;

    public SonarSourceClient(WebClient.Builder webClientBuilder,
                             @Qualifier("sonarRateLimiter") RateLimiter rateLimiter,
                             @Value("${sources.sonar.base-url:https://api.perplexity.ai}") String baseUrl,
                             @Value("${sources.sonar.api-key:}") String apiKey,
                             @Value("${sources.sonar.model:sonar}") String model,
                             @Value("${sources.sonar.max-tokens:2048}") int maxTokens,
                             @Value("${sources.sonar.temperature:0.1}") double temperature,
                             @Value("${sources.sonar.request-timeout:30s}") Duration requestTimeout) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.rateLimiter = rateLimiter;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.requestTimeout = requestTimeout;
        if (!isConfigured()) {
            log.warn("Sonar source disabled: sources.sonar.api-key is not set");
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
    public Mono<RawSourceResponse> query(String prompt) {
        String subject = preview(prompt);
        if (!isConfigured()) {
            ExternalApiLogger.logSourceDisabled(log, SOURCE_NAME, subject);
            return Mono.error(new SourceNotConfiguredException(SOURCE_NAME));
        }
        return webClient.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody(prompt))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .doOnSubscribe(s -> ExternalApiLogger.logApiCallAttempt(log, SOURCE_NAME, "CHAT_COMPLETION", subject))
                .timeout(requestTimeout)
                .transformDeferred(RateLimiterOperator.of(rateLimiter))
                .map(SonarSourceClient::toRawResponse)
                .doOnSuccess(response -> ExternalApiLogger.logApiCallSuccess(log, SOURCE_NAME, "CHAT_COMPLETION", subject,
                        response == null ? 0 : response.citations().size()))
                .onErrorMap(e -> {
                    SourceUnavailableException classified = SourceErrors.classify(SOURCE_NAME, e);
                    ExternalApiLogger.logApiCallFailure(log, SOURCE_NAME, "CHAT_COMPLETION", subject,
                            classified.getReason().name());
                    return classified;
                });
    }

    private Map<String, Object> requestBody(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        body.put("top_p", 0.9);
        body.put("stream", false);
        return body;
    }

    static RawSourceResponse toRawResponse(JsonNode body) {
        JsonNode content = body == null ? null : body.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isString()) {
            throw new SourceUnavailableException(SOURCE_NAME, Reason.MALFORMED_PAYLOAD, "missing choices[0].message.content");
        }

        List<String> citations = new ArrayList<>();
        JsonNode citationsNode = body.path("citations");
        if (citationsNode.isArray()) {
            for (JsonNode citation : citationsNode) {
                String url = citation.asString(null);
                if (StringUtils.hasText(url)) {
                    citations.add(url);
                }
            }
        }

        List<RelatedResult> related = new ArrayList<>();
        JsonNode resultsNode = body.path("search_results");
        if (resultsNode.isArray()) {
            for (JsonNode result : resultsNode) {
                String url = result.path("url").asString(null);
                if (StringUtils.hasText(url)) {
                    related.add(new RelatedResult(url, result.path("title").asString(null)));
                }
            }
        }
        return new RawSourceResponse(content.asString(), citations, related);
    }

    private static String preview(String prompt) {
        if (prompt == null) {
            return "";
        }
        String firstLine = prompt.strip().lines().findFirst().orElse("");
        return firstLine.length() <= PROMPT_PREVIEW_LENGTH ? firstLine : firstLine.substring(0, PROMPT_PREVIEW_LENGTH) + "...";
    }
}
