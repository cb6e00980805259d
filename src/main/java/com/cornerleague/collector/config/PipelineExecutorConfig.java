package com.cornerleague.collector.config;

import com.cornerleague.collector.service.crawl.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class PipelineExecutorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExecutorService discoveryExecutor(@Value("${ingestion.discovery-threads:4}") int threads) {
        return Executors.newFixedThreadPool(threads);
    }

    @Bean
    public ExecutorService fetchExecutor(@Value("${ingestion.fetch-threads:16}") int threads) {
        return Executors.newFixedThreadPool(threads);
    }

    @Bean
    public ExecutorService summarizerExecutor(@Value("${summarizer.threads:2}") int threads) {
        return Executors.newFixedThreadPool(threads);
    }

    @Bean
    public RetryPolicy fetchRetryPolicy(
            @Value("${crawler.max-retries:3}") int maxRetries,
            @Value("${crawler.retry-base-delay-ms:1000}") long baseDelayMs,
            @Value("${crawler.retry-max-delay-ms:60000}") long maxDelayMs
    ) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxDelayMs);
    }
}
