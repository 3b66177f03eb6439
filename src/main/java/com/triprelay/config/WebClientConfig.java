package com.triprelay.config;

import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient for the reasoning service, with its own connect/read timeouts
 */
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final DaemonProperties properties;

    @Bean
    public WebClient reasonerWebClient(WebClient.Builder builder) {
        DaemonProperties.Reasoner reasoner = properties.getReasoner();

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(reasoner.getMaxResponseBytes()))
                .build();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) reasoner.getConnectTimeoutMs())
                .responseTimeout(Duration.ofMillis(reasoner.getReadTimeoutMs()));

        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }
}
