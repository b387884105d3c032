package com.benchwise.infrastructure.ai.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Model gateway wiring.
 *
 * @author benchwise
 * @since 2026-03-08
 */
@Configuration
@EnableConfigurationProperties(ModelGatewayProperties.class)
public class ModelGatewayConfig {

    /**
     * Pool the gateway uses to bound each call with a timeout.
     */
    @Bean(name = "modelGatewayExecutor", destroyMethod = "shutdownNow")
    public ExecutorService modelGatewayExecutor(ModelGatewayProperties properties) {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "model-gateway-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(properties.getMaxConcurrency(), 1), threadFactory);
    }
}
