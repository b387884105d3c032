package com.benchwise.test;

import com.benchwise.domain.task.model.entity.AgentTaskEntity;
import com.benchwise.domain.task.service.TaskLifecycleDomainService;
import com.benchwise.test.support.InMemoryAgentTaskRepository;
import com.benchwise.test.support.InMemoryTaskExecutionRepository;
import com.benchwise.trigger.application.command.AgentTaskExecutionService;
import com.benchwise.trigger.job.PendingTaskDispatchJob;
import com.benchwise.trigger.job.StaleTaskWatchdogDaemon;
import com.benchwise.types.enums.AgentTypeEnum;
import com.benchwise.types.enums.ResponseCode;
import com.benchwise.types.enums.TaskStatusEnum;
import com.benchwise.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TaskJobsTest {

    private InMemoryAgentTaskRepository taskRepository;
    private TaskLifecycleDomainService lifecycle;

    @BeforeEach
    public void setUp() {
        taskRepository = new InMemoryAgentTaskRepository();
        lifecycle = new TaskLifecycleDomainService(taskRepository, new InMemoryTaskExecutionRepository());
    }

    @Test
    public void shouldFailOnlyTasksWithStaleHeartbeat() {
        AgentTaskEntity stale = runningTask();
        AgentTaskEntity fresh = runningTask();
        taskRepository.setHeartbeat(stale.getId(), LocalDateTime.now().minusSeconds(120));
        StaleTaskWatchdogDaemon daemon = new StaleTaskWatchdogDaemon(lifecycle, 60, 10);

        daemon.failOrphanedTasks();

        Assertions.assertEquals(TaskStatusEnum.FAILED, lifecycle.requireTask(stale.getId()).getStatus());
        Assertions.assertEquals(TaskStatusEnum.RUNNING, lifecycle.requireTask(fresh.getId()).getStatus());
    }

    @Test
    public void shouldLeaveHealthyTasksAlone() {
        AgentTaskEntity task = runningTask();
        StaleTaskWatchdogDaemon daemon = new StaleTaskWatchdogDaemon(lifecycle, 0, 0);

        daemon.failOrphanedTasks();

        Assertions.assertEquals(TaskStatusEnum.RUNNING, lifecycle.requireTask(task.getId()).getStatus());
    }

    @Test
    public void shouldDispatchPendingTasksUpToBatchSize() {
        AgentTaskExecutionService runner = mock(AgentTaskExecutionService.class);
        AgentTaskEntity first = pendingTask();
        AgentTaskEntity second = pendingTask();
        AgentTaskEntity third = pendingTask();
        PendingTaskDispatchJob job = new PendingTaskDispatchJob(lifecycle, runner, 2);

        job.dispatchPendingTasks();

        verify(runner).submit(first.getId());
        verify(runner).submit(second.getId());
        verify(runner, never()).submit(third.getId());
    }

    @Test
    public void shouldNotResubmitTasksStillWaitingInQueue() {
        AgentTaskExecutionService runner = mock(AgentTaskExecutionService.class);
        AgentTaskEntity first = pendingTask();
        AgentTaskEntity second = pendingTask();
        PendingTaskDispatchJob job = new PendingTaskDispatchJob(lifecycle, runner, 1);

        job.dispatchPendingTasks();
        job.dispatchPendingTasks();
        job.dispatchPendingTasks();

        verify(runner, times(1)).submit(first.getId());
        verify(runner, times(1)).submit(second.getId());
    }

    @Test
    public void shouldForgetQueuedTaskOnceItLeavesPending() {
        AgentTaskExecutionService runner = mock(AgentTaskExecutionService.class);
        AgentTaskEntity first = pendingTask();
        PendingTaskDispatchJob job = new PendingTaskDispatchJob(lifecycle, runner, 5);

        job.dispatchPendingTasks();
        lifecycle.updateTaskStatus(first.getId(), TaskStatusEnum.RUNNING, 0, null, null);
        AgentTaskEntity second = pendingTask();
        job.dispatchPendingTasks();

        verify(runner, times(1)).submit(first.getId());
        verify(runner, times(1)).submit(second.getId());
    }

    @Test
    public void shouldRetryTaskWhenSubmissionWasRejected() {
        AgentTaskExecutionService runner = mock(AgentTaskExecutionService.class);
        AgentTaskEntity task = pendingTask();
        when(runner.submit(task.getId()))
                .thenThrow(new AppException(ResponseCode.ILLEGAL_STATE.getCode(), "Task worker pool is saturated"))
                .thenReturn(task);
        PendingTaskDispatchJob job = new PendingTaskDispatchJob(lifecycle, runner, 5);

        job.dispatchPendingTasks();
        job.dispatchPendingTasks();
        job.dispatchPendingTasks();

        verify(runner, times(2)).submit(task.getId());
    }

    @Test
    public void shouldStopDispatchWhenWorkersAreSaturated() {
        AgentTaskExecutionService runner = mock(AgentTaskExecutionService.class);
        pendingTask();
        pendingTask();
        when(runner.submit(anyLong())).thenThrow(
                new AppException(ResponseCode.ILLEGAL_STATE.getCode(), "Task worker pool is saturated"));
        PendingTaskDispatchJob job = new PendingTaskDispatchJob(lifecycle, runner, 20);

        job.dispatchPendingTasks();

        verify(runner, times(1)).submit(anyLong());
    }

    private AgentTaskEntity pendingTask() {
        return lifecycle.createTask(1L, AgentTypeEnum.DISCOVERY, Map.of("query", "review"), null);
    }

    private AgentTaskEntity runningTask() {
        AgentTaskEntity task = pendingTask();
        lifecycle.updateTaskStatus(task.getId(), TaskStatusEnum.RUNNING, 0, null, null);
        return task;
    }
}
