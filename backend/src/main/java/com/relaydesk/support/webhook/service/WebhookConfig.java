package com.relaydesk.support.webhook.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class WebhookConfig {

    @Bean
    public RestTemplate webhookRestTemplate(
            RestTemplateBuilder builder,
            @Value("${app.webhook.timeout-ms:5000}") long timeoutMs
    ) {
        var timeout = Duration.ofMillis(Math.max(100, timeoutMs));
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Bean(name = "webhookExecutor")
    public ThreadPoolTaskExecutor webhookExecutor(@Value("${app.webhook.pool-size:4}") int poolSize) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, poolSize));
        executor.setMaxPoolSize(Math.max(1, poolSize));
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("webhook-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
