package com.benchwise.domain.agent.model.valobj;

/**
 * Raised at a checkpoint once the execution's cancellation signal is tripped.
 */
public class ExecutionCancelledException extends RuntimeException {

    private static final long serialVersionUID = -2417958730264061179L;

    public ExecutionCancelledException(Long taskId) {
        super("Execution cancelled. taskId=" + taskId);
    }
}
