package com.benchwise.trigger.job;

import com.benchwise.domain.task.model.entity.AgentTaskEntity;
import com.benchwise.domain.task.service.TaskLifecycleDomainService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Fails running tasks whose heartbeat went stale, e.g. after the owning process died.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "task-watchdog", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StaleTaskWatchdogDaemon {

    private final TaskLifecycleDomainService taskLifecycleDomainService;
    private final long staleAfterSeconds;
    private final int batchSize;
    private final Counter orphanedCounter;

    public StaleTaskWatchdogDaemon(TaskLifecycleDomainService taskLifecycleDomainService,
                                   @Value("${task-watchdog.stale-after-seconds:1800}") long staleAfterSeconds,
                                   @Value("${task-watchdog.batch-size:100}") int batchSize) {
        this.taskLifecycleDomainService = taskLifecycleDomainService;
        this.staleAfterSeconds = staleAfterSeconds > 0 ? staleAfterSeconds : 1800L;
        this.batchSize = batchSize > 0 ? batchSize : 100;
        this.orphanedCounter = Counter.builder("agent.task.watchdog.orphaned.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${task-watchdog.poll-interval-ms:60000}", scheduler = "daemonScheduler")
    public void failOrphanedTasks() {
        LocalDateTime heartbeatBefore = LocalDateTime.now().minusSeconds(staleAfterSeconds);
        List<AgentTaskEntity> failed = taskLifecycleDomainService.failOrphanedTasks(heartbeatBefore, batchSize);
        if (failed.isEmpty()) {
            return;
        }
        orphanedCounter.increment(failed.size());
        for (AgentTaskEntity task : failed) {
            log.warn("Orphaned task failed by watchdog. taskId={}, heartbeatAt={}, startedAt={}",
                    task.getId(), task.getHeartbeatAt(), task.getStartedAt());
        }
    }
}
