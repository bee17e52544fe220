package com.newsflow.core.persistence;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node invocation scheduled for the next superstep.
 *
 * @param node      node name
 * @param fanOut    true when produced by a dynamic fan-out edge; fan-out tasks run
 *                  concurrently and are never de-duplicated
 * @param arguments values overlaid on the branch's copy of the state (empty for plain tasks)
 */
public record PendingTask(String node, boolean fanOut, Map<String, Object> arguments) implements Serializable {

    public PendingTask {
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static PendingTask plain(String node) {
        return new PendingTask(node, false, Map.of());
    }

    public static PendingTask fanOut(String node, Map<String, Object> arguments) {
        return new PendingTask(node, true, arguments);
    }
}
