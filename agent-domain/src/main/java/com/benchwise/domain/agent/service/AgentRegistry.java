package com.benchwise.domain.agent.service;

import com.benchwise.types.enums.AgentTypeEnum;
import com.benchwise.types.enums.ResponseCode;
import com.benchwise.types.exception.AppException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Agents keyed by type tag. Two agents claiming the same type fail startup.
 *
 * @author benchwise
 * @since 2026-03-04
 */
@Component
public class AgentRegistry {

    private final Map<AgentTypeEnum, ILegalAgent> agents = new EnumMap<>(AgentTypeEnum.class);

    public AgentRegistry(List<ILegalAgent> agentList) {
        if (agentList == null) {
            return;
        }
        for (ILegalAgent agent : agentList) {
            ILegalAgent existing = agents.putIfAbsent(agent.getType(), agent);
            if (existing != null) {
                throw new IllegalStateException("Duplicate agent for type " + agent.getType().getCode()
                        + ": " + existing.getId() + ", " + agent.getId());
            }
        }
    }

    public Optional<ILegalAgent> find(AgentTypeEnum type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(agents.get(type));
    }

    public ILegalAgent require(AgentTypeEnum type) {
        return find(type).orElseThrow(() -> new AppException(ResponseCode.ILLEGAL_STATE.getCode(),
                "No agent registered for type " + (type == null ? null : type.getCode())));
    }

    public boolean supports(AgentTypeEnum type) {
        return find(type).isPresent();
    }

    public List<ILegalAgent> list() {
        return Collections.unmodifiableList(new ArrayList<>(agents.values()));
    }
}
