package com.benchwise.domain.agent.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent output. Expected failures are reported with {@code success=false} and an error,
 * never thrown.
 *
 * @author benchwise
 * @since 2026-03-04
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentOutput {

    /** Error text of an output produced after cooperative cancellation */
    public static final String CANCELLED_ERROR = "cancelled";

    private boolean success;

    private Object result;

    private String error;

    @Builder.Default
    private List<Citation> citations = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * Elapsed time in milliseconds
     */
    private long executionTime;

    public static AgentOutput failure(String error) {
        return AgentOutput.builder().success(false).error(error).build();
    }

    public boolean isCancelled() {
        return !success && CANCELLED_ERROR.equals(error);
    }
}
