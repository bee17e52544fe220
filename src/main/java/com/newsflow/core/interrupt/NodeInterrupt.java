package com.newsflow.core.interrupt;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unwinds a node that asked to suspend back to the scheduler.
 * <p>
 * Thrown only by {@link Interrupts#suspend}. Nodes must let it propagate; the
 * retry handler never retries it.
 */
public class NodeInterrupt extends RuntimeException {

    private final transient Map<String, Object> payload;

    public NodeInterrupt(Map<String, Object> payload) {
        super("Node suspended awaiting a resume decision", null, false, false);
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public Map<String, Object> payload() {
        return payload;
    }
}
