package com.clapgrow.reminder.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient configuration for the Telegram Bot API.
 * Uses Reactor Netty HTTP client (not server); WebFlux auto-configuration is
 * excluded in ReminderApiApplication so the servlet stack stays in charge.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient telegramWebClient(
            @Value("${telegram.api.base-url:https://api.telegram.org}") String baseUrl,
            @Value("${telegram.bot-token:}") String botToken,
            @Value("${telegram.api.timeout-seconds:15}") long timeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(timeoutSeconds));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(baseUrl + "/bot" + botToken)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
