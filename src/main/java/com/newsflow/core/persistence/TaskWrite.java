package com.newsflow.core.persistence;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of a task that finished in a superstep that was then suspended.
 * Replayed on resume instead of executing the task again.
 */
public record TaskWrite(int taskIndex, String node, Map<String, Object> update) implements Serializable {

    public TaskWrite {
        update = update == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(update));
    }
}
