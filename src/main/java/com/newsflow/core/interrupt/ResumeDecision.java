package com.newsflow.core.interrupt;

import java.io.Serializable;
import java.util.Locale;
import java.util.Map;

/**
 * External decision delivered back into a suspended node.
 *
 * @param action   what the reviewer decided (required)
 * @param feedback optional free text, empty when absent
 */
public record ResumeDecision(Action action, String feedback) implements Serializable {

    public enum Action {
        APPROVE,
        REJECT
    }

    public ResumeDecision {
        feedback = feedback != null ? feedback : "";
    }

    public static ResumeDecision approve() {
        return new ResumeDecision(Action.APPROVE, "");
    }

    public static ResumeDecision reject(String feedback) {
        return new ResumeDecision(Action.REJECT, feedback);
    }

    public boolean approved() {
        return action == Action.APPROVE;
    }

    /**
     * Parses an {@code action}/{@code feedback} pair as submitted by a caller.
     *
     * @throws InterruptProtocolException when the action is missing or unknown
     */
    public static ResumeDecision parse(String action, String feedback) {
        if (action == null || action.isBlank()) {
            throw new InterruptProtocolException("Resume decision requires an action (approve|reject)");
        }
        try {
            return new ResumeDecision(Action.valueOf(action.trim().toUpperCase(Locale.ROOT)), feedback);
        } catch (IllegalArgumentException e) {
            throw new InterruptProtocolException("Unknown resume action '" + action + "' (expected approve|reject)");
        }
    }

    public static ResumeDecision fromMap(Map<String, ?> decision) {
        Object action = decision.get("action");
        Object feedback = decision.get("feedback");
        return parse(action != null ? action.toString() : null, feedback != null ? feedback.toString() : null);
    }

    public static void requireValid(ResumeDecision decision) {
        if (decision == null || decision.action() == null) {
            throw new InterruptProtocolException("Resume decision requires an action (approve|reject)");
        }
    }
}
