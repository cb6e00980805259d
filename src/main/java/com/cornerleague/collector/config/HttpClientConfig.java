package com.cornerleague.collector.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(
            RestTemplateBuilder builder,
            @Value("${summarizer.timeout-seconds:30}") int timeoutSeconds
    ) {
        Duration timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
        return builder
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build();
    }
}
