package com.benchwise.domain.review.model.valobj;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A discovery request the documents are checked against.
 *
 * @param id   request ID, generated from the position when not supplied
 * @param text request text
 */
public record DiscoveryRequest(String id, String text) {

    /**
     * Parse the {@code discoveryRequests} parameter: plain strings or {@code {id, text}} objects.
     */
    public static List<DiscoveryRequest> fromParameter(Object raw) {
        List<DiscoveryRequest> requests = new ArrayList<>();
        if (raw == null) {
            return requests;
        }
        Collection<?> items = raw instanceof Collection ? (Collection<?>) raw : List.of(raw);
        int position = 0;
        for (Object item : items) {
            position++;
            if (item instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) item;
                Object text = map.get("text");
                if (text == null) {
                    continue;
                }
                Object id = map.get("id");
                requests.add(new DiscoveryRequest(id == null ? String.valueOf(position) : String.valueOf(id),
                        String.valueOf(text)));
            } else if (item != null) {
                requests.add(new DiscoveryRequest(String.valueOf(position), String.valueOf(item)));
            }
        }
        return requests;
    }
}
