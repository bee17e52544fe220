package com.newsflow.core.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies per-field merge disciplines to partial updates.
 * <p>
 * {@link #merge} is pure: the base map and the updates are never modified and the
 * result depends only on their contents and on the order of {@code updates}. Callers
 * pass updates in launch order, so append fields concatenate deterministically no
 * matter when each contribution was produced.
 */
public final class StateReducer {

    private final Map<String, Channel> schema;

    public StateReducer(Map<String, Channel> schema) {
        this.schema = Map.copyOf(Objects.requireNonNull(schema, "schema must not be null"));
    }

    public Map<String, Channel> schema() {
        return schema;
    }

    /**
     * Builds the first state of a run: schema defaults for absent fields, caller values otherwise.
     */
    public Map<String, Object> initialize(Map<String, Object> input) {
        var state = new LinkedHashMap<String, Object>();
        for (var entry : schema.entrySet()) {
            Channel channel = entry.getValue();
            if (input.containsKey(entry.getKey())) {
                Object value = input.get(entry.getKey());
                state.put(entry.getKey(), channel.appends() ? appendTo(List.of(), value) : value);
            } else {
                state.put(entry.getKey(), channel.initialValue());
            }
        }
        for (var entry : input.entrySet()) {
            state.putIfAbsent(entry.getKey(), entry.getValue());
        }
        return state;
    }

    /**
     * Merges updates into base. Fields absent from every update keep their base value.
     */
    public Map<String, Object> merge(Map<String, Object> base, List<Map<String, Object>> updates) {
        var merged = new LinkedHashMap<String, Object>(base);
        var appended = new LinkedHashMap<String, List<Object>>();

        for (Map<String, Object> update : updates) {
            if (update == null) continue;
            for (var entry : update.entrySet()) {
                String key = entry.getKey();
                Channel channel = schema.get(key);
                if (channel != null && channel.appends()) {
                    if (entry.getValue() == null) continue;
                    List<Object> target = appended.computeIfAbsent(key,
                            k -> new ArrayList<>(asList(base.get(k))));
                    addContribution(target, entry.getValue());
                } else {
                    merged.put(key, entry.getValue());
                }
            }
        }

        appended.forEach((key, values) -> merged.put(key, Collections.unmodifiableList(values)));
        return merged;
    }

    private static List<Object> appendTo(List<Object> existing, Object contribution) {
        var values = new ArrayList<>(existing);
        if (contribution != null) {
            addContribution(values, contribution);
        }
        return Collections.unmodifiableList(values);
    }

    private static void addContribution(List<Object> target, Object contribution) {
        if (contribution instanceof Collection<?> items) {
            target.addAll(items);
        } else {
            target.add(contribution);
        }
    }

    private static List<?> asList(Object value) {
        if (value == null) return List.of();
        if (value instanceof List<?> list) return list;
        if (value instanceof Collection<?> items) return new ArrayList<>(items);
        return List.of(value);
    }
}
