package com.benchwise.trigger.job;

import com.benchwise.domain.task.model.entity.AgentTaskEntity;
import com.benchwise.domain.task.service.TaskLifecycleDomainService;
import com.benchwise.trigger.application.command.AgentTaskExecutionService;
import com.benchwise.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Optional dispatcher that starts pending tasks without an explicit execute call.
 * A task stays pending while it waits in the worker queue, so submitted IDs are remembered
 * until the task leaves pending and are not queued again.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "executor.dispatch", name = "enabled", havingValue = "true")
public class PendingTaskDispatchJob {

    private final TaskLifecycleDomainService taskLifecycleDomainService;
    private final AgentTaskExecutionService agentTaskExecutionService;
    private final int batchSize;
    private final Set<Long> queuedTaskIds = ConcurrentHashMap.newKeySet();

    public PendingTaskDispatchJob(TaskLifecycleDomainService taskLifecycleDomainService,
                                  AgentTaskExecutionService agentTaskExecutionService,
                                  @Value("${executor.dispatch.batch-size:20}") int batchSize) {
        this.taskLifecycleDomainService = taskLifecycleDomainService;
        this.agentTaskExecutionService = agentTaskExecutionService;
        this.batchSize = batchSize > 0 ? batchSize : 20;
    }

    @Scheduled(fixedDelayString = "${executor.dispatch.poll-interval-ms:2000}", scheduler = "taskExecutorScheduler")
    public void dispatchPendingTasks() {
        List<AgentTaskEntity> pending = taskLifecycleDomainService.getPendingTasks();
        if (pending == null || pending.isEmpty()) {
            queuedTaskIds.clear();
            return;
        }
        Set<Long> pendingIds = pending.stream().map(AgentTaskEntity::getId).collect(Collectors.toSet());
        queuedTaskIds.retainAll(pendingIds);
        int dispatched = 0;
        for (AgentTaskEntity task : pending) {
            if (dispatched >= batchSize) {
                break;
            }
            if (queuedTaskIds.contains(task.getId())) {
                continue;
            }
            try {
                agentTaskExecutionService.submit(task.getId());
                queuedTaskIds.add(task.getId());
                dispatched++;
            } catch (AppException ex) {
                log.warn("Pending task dispatch stopped. taskId={}, code={}, error={}",
                        task.getId(), ex.getCode(), ex.getInfo());
                break;
            }
        }
        if (dispatched > 0) {
            log.info("Pending tasks dispatched. count={}", dispatched);
        }
    }
}
