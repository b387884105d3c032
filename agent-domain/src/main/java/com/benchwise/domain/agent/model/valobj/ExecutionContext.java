package com.benchwise.domain.agent.model.valobj;

import java.util.function.BooleanSupplier;

/**
 * Per-execution context passed down to an agent.
 * <p>
 * Carries the cancellation signal of this execution and the sink for progress reports.
 * {@link #checkpoint()} consults the stop probe, so a cancellation written by any process
 * trips the signal at the next checkpoint. Progress reported through this context never goes
 * backwards.
 * </p>
 *
 * @author benchwise
 * @since 2026-03-04
 */
public final class ExecutionContext {

    /**
     * Receives progress reports of an execution.
     */
    @FunctionalInterface
    public interface ProgressListener {
        void onProgress(int progress, String step);
    }

    private static final BooleanSupplier NEVER_STOP = () -> false;
    private static final ProgressListener NO_PROGRESS = (progress, step) -> { };

    private final Long taskId;
    private final Long executionId;
    private final CancellationSignal cancellationSignal;
    private final BooleanSupplier stopProbe;
    private final ProgressListener progressListener;
    private int lastProgress = -1;

    public ExecutionContext(Long taskId,
                            Long executionId,
                            BooleanSupplier stopProbe,
                            ProgressListener progressListener) {
        this.taskId = taskId;
        this.executionId = executionId;
        this.cancellationSignal = new CancellationSignal();
        this.stopProbe = stopProbe == null ? NEVER_STOP : stopProbe;
        this.progressListener = progressListener == null ? NO_PROGRESS : progressListener;
    }

    /**
     * Context for a direct agent call outside the task runner.
     */
    public static ExecutionContext detached() {
        return new ExecutionContext(null, null, NEVER_STOP, NO_PROGRESS);
    }

    public Long getTaskId() {
        return taskId;
    }

    public Long getExecutionId() {
        return executionId;
    }

    public CancellationSignal getCancellationSignal() {
        return cancellationSignal;
    }

    /**
     * Report progress. Values lower than the last reported one are dropped.
     */
    public synchronized void reportProgress(int progress, String step) {
        int clamped = Math.max(0, Math.min(100, progress));
        if (clamped < lastProgress) {
            return;
        }
        lastProgress = clamped;
        progressListener.onProgress(clamped, step);
    }

    public synchronized int getLastProgress() {
        return Math.max(lastProgress, 0);
    }

    /**
     * Stop here if cancellation was requested.
     *
     * @throws ExecutionCancelledException when the signal is tripped
     */
    public void checkpoint() {
        if (!cancellationSignal.isTripped() && stopProbe.getAsBoolean()) {
            cancellationSignal.trip();
        }
        if (cancellationSignal.isTripped()) {
            throw new ExecutionCancelledException(taskId);
        }
    }

    public boolean isCancellationRequested() {
        return cancellationSignal.isTripped();
    }
}
