package com.dealsim.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * HTTP client for the negotiation engine. The read timeout bounds the silence between two
 * streamed rounds, not the whole run.
 */
@Slf4j
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder(ObjectMapper objectMapper,
                                              @Value("${engine.http.max-connections:50}") int maxConnections,
                                              @Value("${engine.http.connect-timeout-ms:10000}") int connectTimeoutMs,
                                              @Value("${engine.http.read-timeout-seconds:300}") int readTimeoutSeconds,
                                              @Value("${engine.http.max-in-memory-size:4194304}") int maxInMemorySize) {
        ExchangeStrategies strategies = ExchangeStrategies
                .builder()
                .codecs(configurer -> {
                    configurer.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(objectMapper,
                            MediaType.APPLICATION_JSON, MediaType.APPLICATION_NDJSON));
                    configurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper,
                            MediaType.APPLICATION_JSON));
                    configurer.defaultCodecs().maxInMemorySize(maxInMemorySize);
                })
                .build();

        ConnectionProvider provider = ConnectionProvider
                .builder("negotiation-engine")
                .maxConnections(Math.max(maxConnections, 1))
                .maxIdleTime(Duration.ofSeconds(20))
                .pendingAcquireTimeout(Duration.ofSeconds(30))
                .evictInBackground(Duration.ofSeconds(30))
                .build();

        int readTimeout = Math.max(readTimeoutSeconds, 1);
        HttpClient httpClient = HttpClient.create(provider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.max(connectTimeoutMs, 1))
                .responseTimeout(Duration.ofSeconds(readTimeout))
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(readTimeout))
                        .addHandlerLast(new WriteTimeoutHandler(60)));

        log.info("Engine WebClient configured. maxConnections={}, connectTimeoutMs={}, readTimeoutSeconds={}",
                maxConnections, connectTimeoutMs, readTimeout);
        return WebClient.builder()
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
