package com.newsflow.core.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over the field map threaded through every node.
 * <p>
 * Subclasses add typed accessors; the engine only ever sees the raw map.
 */
public class GraphState {

    private final Map<String, Object> data;

    public GraphState(Map<String, Object> initData) {
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(initData));
    }

    public Map<String, Object> data() {
        return data;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> value(String key) {
        return Optional.ofNullable((T) data.get(key));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + data;
    }
}
