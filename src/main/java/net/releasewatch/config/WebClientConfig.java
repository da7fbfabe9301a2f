/**
 * Configuration for WebClient
 * - Defines the shared builder used by the AniList, feed and calendar clients
 * - Sets up default timeouts and connection settings
 */
package net.releasewatch.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
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
 * - Per-call timeouts are applied by each client on top of these connection limits
 */
@Configuration
public class WebClientConfig {

    private static final String DEFAULT_USER_AGENT = "release-watch/0.1 (+https://github.com/release-watch)";

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Sets connection timeout to 10 seconds
     * - Sets read and write timeouts to 30 seconds
     * - Sets response timeout to 30 seconds
     *
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(30, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(30, TimeUnit.SECONDS))
            )
            .responseTimeout(Duration.ofSeconds(30));

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(5 * 1024 * 1024)) // 5MB, large feeds included
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, DEFAULT_USER_AGENT)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
