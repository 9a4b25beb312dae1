/**
 * Configuration for WebClient
 * - Defines the shared builder used by the upstream source clients
 * - Sets up timeouts sized for slow AI search answers
 */
package net.findmyaisle.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configures the application's WebClient instances
 * - Provides a pre-configured WebClient Builder
 * - Ensures consistent HTTP client behavior across sources
 */
@Configuration
public class WebClientConfig {

    private static final String USER_AGENT = "findmyaisle/0.1 (+https://findmyaisle.net)";

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Connection timeout of 5 seconds
     * - Read, write and response timeouts from {@code http.client.response-timeout} (30s default)
     *
     * @param responseTimeout upper bound for one upstream exchange
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder(@Value("${http.client.response-timeout:30s}") Duration responseTimeout) {
        long timeoutSeconds = Math.max(1, responseTimeout.toSeconds());
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            )
            .responseTimeout(responseTimeout);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(10 * 1024 * 1024)) // 10MB
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
