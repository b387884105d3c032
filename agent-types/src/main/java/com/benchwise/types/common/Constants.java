package com.benchwise.types.common;

/**
 * Global constants.
 *
 * @author benchwise
 * @since 2026-03-02
 */
public class Constants {

    /** Comma separator */
    public final static String SPLIT = ",";

    /** Input context key carrying the task ID */
    public final static String CONTEXT_TASK_ID = "taskId";

    /** Input context key carrying the execution ID */
    public final static String CONTEXT_EXECUTION_ID = "executionId";

    /** Input context key carrying the resolved matter info */
    public final static String CONTEXT_MATTER_INFO = "matterInfo";

}
