package com.benchwise.test.domain;

import com.benchwise.domain.agent.model.valobj.AgentCapability;
import com.benchwise.domain.agent.model.valobj.AgentInput;
import com.benchwise.domain.agent.model.valobj.AgentOutput;
import com.benchwise.domain.agent.model.valobj.ExecutionCancelledException;
import com.benchwise.domain.agent.model.valobj.ExecutionContext;
import com.benchwise.domain.agent.service.AbstractLegalAgent;
import com.benchwise.domain.agent.service.AgentRegistry;
import com.benchwise.domain.agent.service.ILegalAgent;
import com.benchwise.types.enums.AgentTypeEnum;
import com.benchwise.types.enums.ResponseCode;
import com.benchwise.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

public class AgentRuntimeTest {

    @Test
    public void shouldResolveAgentByType() {
        EchoAgent agent = new EchoAgent(AgentTypeEnum.DISCOVERY);
        AgentRegistry registry = new AgentRegistry(List.of(agent));

        Assertions.assertSame(agent, registry.require(AgentTypeEnum.DISCOVERY));
        Assertions.assertTrue(registry.supports(AgentTypeEnum.DISCOVERY));
        Assertions.assertFalse(registry.supports(AgentTypeEnum.RESEARCH));
        Assertions.assertTrue(registry.find(null).isEmpty());
        Assertions.assertEquals(1, registry.list().size());
    }

    @Test
    public void shouldRejectUnregisteredType() {
        AgentRegistry registry = new AgentRegistry(List.of());

        AppException ex = Assertions.assertThrows(AppException.class, () -> registry.require(AgentTypeEnum.CONTRACT));

        Assertions.assertEquals(ResponseCode.ILLEGAL_STATE.getCode(), ex.getCode());
        Assertions.assertEquals("No agent registered for type contract", ex.getInfo());
    }

    @Test
    public void shouldRejectDuplicateAgentsForOneType() {
        Assertions.assertThrows(IllegalStateException.class, () -> new AgentRegistry(List.of(
                new EchoAgent(AgentTypeEnum.DISCOVERY), new EchoAgent(AgentTypeEnum.DISCOVERY))));
    }

    @Test
    public void shouldDropBackwardProgressAndClamp() {
        List<Integer> reported = new ArrayList<>();
        ExecutionContext context = new ExecutionContext(1L, 2L, () -> false, (progress, step) -> reported.add(progress));

        context.reportProgress(40, "a");
        context.reportProgress(20, "b");
        context.reportProgress(40, "c");
        context.reportProgress(180, "d");

        Assertions.assertEquals(List.of(40, 40, 100), reported);
        Assertions.assertEquals(100, context.getLastProgress());
    }

    @Test
    public void shouldTripSignalOnceStopCheckReportsStop() {
        AtomicBoolean stop = new AtomicBoolean(false);
        ExecutionContext context = new ExecutionContext(3L, 4L, stop::get, null);

        context.checkpoint();
        Assertions.assertFalse(context.isCancellationRequested());

        stop.set(true);
        Assertions.assertThrows(ExecutionCancelledException.class, context::checkpoint);
        stop.set(false);
        Assertions.assertThrows(ExecutionCancelledException.class, context::checkpoint);
        Assertions.assertTrue(context.getCancellationSignal().isTripped());
    }

    @Test
    public void shouldCaptureAgentFailureAsOutput() {
        EchoAgent agent = new EchoAgent(AgentTypeEnum.DISCOVERY);
        agent.failWith = new IllegalStateException("index unavailable");

        AgentOutput output = agent.execute(input("find"), null);

        Assertions.assertFalse(output.isSuccess());
        Assertions.assertFalse(output.isCancelled());
        Assertions.assertEquals("index unavailable", output.getError());
        Assertions.assertTrue(output.getExecutionTime() >= 0);
    }

    @Test
    public void shouldRejectBlankQuery() {
        EchoAgent agent = new EchoAgent(AgentTypeEnum.DISCOVERY);

        AgentOutput output = agent.execute(input("  "), ExecutionContext.detached());

        Assertions.assertFalse(output.isSuccess());
        Assertions.assertEquals("Invalid input parameters", output.getError());
        Assertions.assertEquals(0, agent.calls);
    }

    @Test
    public void shouldParseStoredInputConfig() {
        LinkedHashMap<String, Object> config = new LinkedHashMap<>();
        config.put("query", "find");
        config.put("documents", List.of(3, "4", 5L));

        AgentInput input = AgentInput.fromInputConfig(8L, config);

        Assertions.assertEquals(List.of(3L, 4L, 5L), input.getDocuments());
        Assertions.assertEquals(8L, input.getMatterId());
        Assertions.assertTrue(input.getParameters().isEmpty());

        config.put("documents", List.of("abc"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> AgentInput.fromInputConfig(8L, config));
    }

    private AgentInput input(String query) {
        return AgentInput.builder()
                .query(query)
                .parameters(new LinkedHashMap<>())
                .context(new LinkedHashMap<>())
                .build();
    }

    private static class EchoAgent extends AbstractLegalAgent implements ILegalAgent {

        private final AgentTypeEnum type;
        private RuntimeException failWith;
        private int calls;

        EchoAgent(AgentTypeEnum type) {
            super(id -> null);
            this.type = type;
        }

        @Override
        public String getId() {
            return "echo-" + type.getCode();
        }

        @Override
        public AgentTypeEnum getType() {
            return type;
        }

        @Override
        public String getName() {
            return "Echo";
        }

        @Override
        public String getDescription() {
            return "Returns its query";
        }

        @Override
        public List<AgentCapability> getCapabilities() {
            return List.of();
        }

        @Override
        public List<String> getRequiredContext() {
            return List.of();
        }

        @Override
        protected AgentOutput doExecute(AgentInput input, ExecutionContext context) {
            calls++;
            if (failWith != null) {
                throw failWith;
            }
            return AgentOutput.builder().success(true).result(input.getQuery()).build();
        }
    }
}
