package com.benchwise.domain.agent.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent input: query, free-form parameters, optional document IDs and resolved context.
 *
 * @author benchwise
 * @since 2026-03-04
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentInput {

    private Long matterId;

    private String query;

    private Map<String, Object> context;

    private List<Long> documents;

    private Map<String, Object> parameters;

    /**
     * Build from a stored task input payload.
     */
    @SuppressWarnings("unchecked")
    public static AgentInput fromInputConfig(Long matterId, Map<String, Object> inputConfig) {
        Map<String, Object> config = inputConfig == null ? new LinkedHashMap<>() : inputConfig;
        Object query = config.get("query");
        Object context = config.get("context");
        Object parameters = config.get("parameters");
        return AgentInput.builder()
                .matterId(matterId)
                .query(query == null ? null : String.valueOf(query))
                .context(context instanceof Map ? new LinkedHashMap<>((Map<String, Object>) context) : new LinkedHashMap<>())
                .parameters(parameters instanceof Map ? new LinkedHashMap<>((Map<String, Object>) parameters) : new LinkedHashMap<>())
                .documents(toIdList(config.get("documents")))
                .build();
    }

    public Object getParameter(String key) {
        return parameters == null ? null : parameters.get(key);
    }

    public Object getContextValue(String key) {
        return context == null ? null : context.get(key);
    }

    public void putContextValue(String key, Object value) {
        if (context == null) {
            context = new LinkedHashMap<>();
        }
        context.put(key, value);
    }

    public int getDocumentCount() {
        return documents == null ? 0 : documents.size();
    }

    /**
     * Snapshot stored with an execution entry.
     */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("matterId", matterId);
        snapshot.put("query", query);
        snapshot.put("documents", documents == null ? List.of() : new ArrayList<>(documents));
        snapshot.put("parameters", parameters == null ? Map.of() : new LinkedHashMap<>(parameters));
        snapshot.put("context", context == null ? Map.of() : new LinkedHashMap<>(context));
        return snapshot;
    }

    private static List<Long> toIdList(Object raw) {
        List<Long> ids = new ArrayList<>();
        if (!(raw instanceof Collection)) {
            return ids;
        }
        for (Object item : (Collection<?>) raw) {
            if (item instanceof Number) {
                ids.add(((Number) item).longValue());
            } else if (item != null) {
                try {
                    ids.add(Long.parseLong(String.valueOf(item).trim()));
                } catch (NumberFormatException ex) {
                    throw new IllegalArgumentException("Invalid document id: " + item, ex);
                }
            }
        }
        return ids;
    }
}
