package com.newsflow.core.persistence;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The suspension a run is waiting on.
 *
 * @param taskIndex position of the suspended task in the checkpoint's frontier
 * @param node      name of the suspended node
 * @param payload   value handed to the caller for review
 */
public record PendingInterrupt(int taskIndex, String node, Map<String, Object> payload) implements Serializable {

    public PendingInterrupt {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
