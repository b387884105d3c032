package com.benchwise.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for agent task executions.
 * <p>
 * Executions can run for minutes, so they never share threads with the HTTP layer or the
 * schedulers. With the default queue capacity of 0 a saturated pool rejects the submit and
 * the task stays pending.
 * </p>
 *
 * @author benchwise
 * @since 2026-03-10
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    @Bean(name = "taskExecutionWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "taskExecutionWorker")
    public ThreadPoolExecutor taskExecutionWorker(
            @Value("${executor.worker.core-size:4}") int coreSize,
            @Value("${executor.worker.max-size:4}") int maxSize,
            @Value("${executor.worker.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.worker.queue-capacity:0}") int queueCapacity,
            @Value("${executor.worker.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${executor.worker.thread-name-prefix:agent-task-worker-}") String threadNamePrefix) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        return new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                Math.max(keepAliveSeconds, 0L),
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(rejectionPolicy));
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        // Discard policies are not supported: a dropped submit leaves its task pending.
        log.warn("Unsupported rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
