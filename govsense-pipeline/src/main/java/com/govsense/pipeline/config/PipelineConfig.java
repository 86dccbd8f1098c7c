package com.govsense.pipeline.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@Slf4j
public class PipelineConfig {

    public static final String DATA_GOUV_RETRY = "dataGouv";

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, GovSenseProperties properties) {
        GovSenseProperties.Ingestion ingestion = properties.getIngestion();
        return builder
                .setConnectTimeout(ingestion.getConnectTimeout())
                .setReadTimeout(ingestion.getReadTimeout())
                .build();
    }

    @Bean
    public Retry dataGouvRetry(RetryRegistry retryRegistry) {
        Retry retry = retryRegistry.retry(DATA_GOUV_RETRY);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying {} (attempt {}) after: {}",
                event.getName(), event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    /**
     * Runs the per-dataset fetch and clean stages of one refresh in parallel.
     */
    @Bean("fetchExecutor")
    public ThreadPoolTaskExecutor fetchExecutor(GovSenseProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getIngestion().getFetchThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("fetch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Drives the periodic refresh and runs manually triggered refreshes off the request thread.
     */
    @Bean("refreshTaskScheduler")
    public ThreadPoolTaskScheduler refreshTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("refresh-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(120);
        scheduler.initialize();
        return scheduler;
    }
}
