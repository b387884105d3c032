package com.benchwise.domain.agent.service;

import com.benchwise.domain.agent.model.valobj.AgentInput;
import com.benchwise.domain.agent.model.valobj.AgentOutput;
import com.benchwise.domain.agent.model.valobj.ExecutionCancelledException;
import com.benchwise.domain.agent.model.valobj.ExecutionContext;
import com.benchwise.domain.document.adapter.repository.IMatterRepository;
import com.benchwise.domain.document.model.entity.MatterEntity;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Base agent: input validation, duration estimate, timing and failure capture.
 * Subclasses implement {@link #doExecute}.
 *
 * @author benchwise
 * @since 2026-03-04
 */
@Slf4j
public abstract class AbstractLegalAgent implements ILegalAgent {

    private static final int BASE_DURATION_SECONDS = 60;
    private static final int LONG_QUERY_CHARS = 200;

    protected final IMatterRepository matterRepository;

    protected AbstractLegalAgent(IMatterRepository matterRepository) {
        this.matterRepository = matterRepository;
    }

    @Override
    public boolean validateInput(AgentInput input) {
        if (input == null || StringUtils.isBlank(input.getQuery())) {
            return false;
        }
        if (input.getMatterId() != null) {
            for (String requirement : getRequiredContext()) {
                if (!hasContextValue(input, requirement)) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public int estimateDuration(AgentInput input) {
        String query = input == null || input.getQuery() == null ? "" : input.getQuery();
        double queryComplexity = query.length() > LONG_QUERY_CHARS ? 1.5 : 1.0;
        int documentCount = input == null ? 0 : input.getDocumentCount();
        double documentFactor = Math.min(documentCount * 0.1, 2.0);
        return (int) Math.round(BASE_DURATION_SECONDS * queryComplexity * (1 + documentFactor));
    }

    @Override
    public final AgentOutput execute(AgentInput input, ExecutionContext context) {
        long start = System.currentTimeMillis();
        ExecutionContext executionContext = context == null ? ExecutionContext.detached() : context;
        AgentOutput output;
        try {
            if (!validateInput(input)) {
                output = AgentOutput.failure(getInvalidInputMessage());
            } else {
                output = doExecute(input, executionContext);
            }
        } catch (ExecutionCancelledException ex) {
            log.info("Agent execution stopped at checkpoint. agentId={}, taskId={}",
                    getId(), executionContext.getTaskId());
            output = AgentOutput.failure(AgentOutput.CANCELLED_ERROR);
        } catch (RuntimeException ex) {
            log.warn("Agent execution failed. agentId={}, taskId={}, error={}",
                    getId(), executionContext.getTaskId(), ex.getMessage(), ex);
            output = AgentOutput.failure(StringUtils.defaultIfBlank(ex.getMessage(), "Unknown error occurred"));
        }
        output.setExecutionTime(System.currentTimeMillis() - start);
        return output;
    }

    protected abstract AgentOutput doExecute(AgentInput input, ExecutionContext context);

    @Override
    public String getInvalidInputMessage() {
        return "Invalid input parameters";
    }

    /**
     * Stage boundary: stop if cancelled, then report progress.
     */
    protected void logExecution(ExecutionContext context, String step, int progress) {
        context.checkpoint();
        context.reportProgress(progress, step);
        log.debug("Agent step. agentId={}, taskId={}, progress={}, step={}",
                getId(), context.getTaskId(), progress, step);
    }

    /**
     * Matter of the input, or the general research placeholder for matter-less tasks.
     */
    protected MatterEntity getMatterInfo(Long matterId) {
        if (matterId == null) {
            return MatterEntity.generalResearch();
        }
        MatterEntity matter = matterRepository.findById(matterId);
        if (matter == null) {
            throw new IllegalStateException("Failed to fetch matter info: matter " + matterId + " not found");
        }
        return matter;
    }

    private boolean hasContextValue(AgentInput input, String key) {
        Object value = input.getContextValue(key);
        if (value == null) {
            value = input.getParameter(key);
        }
        if (value == null) {
            return false;
        }
        if (value instanceof String) {
            return StringUtils.isNotBlank((String) value);
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return true;
    }
}
