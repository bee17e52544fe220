package com.newsflow.core.interrupt;

import java.util.Map;

/**
 * Human-in-the-loop suspension point for node code.
 * <p>
 * A node calls {@link #suspend} with a payload for the reviewer. The first time
 * round the call never returns: it throws {@link NodeInterrupt}, the scheduler
 * checkpoints the run and hands the payload to the caller. When the run is
 * resumed the node executes again from the top and this time {@code suspend}
 * returns the decision. Nothing local to the node survives in between, so code
 * before the call must only read state, and code after it must rebuild what it
 * needs from the state and the decision.
 */
public final class Interrupts {

    private static final ThreadLocal<Scope> CURRENT = new ThreadLocal<>();

    private Interrupts() {}

    /**
     * Suspends the calling node, or returns the decision when the node is being resumed.
     *
     * @throws NodeInterrupt         on the first execution
     * @throws IllegalStateException when called outside a node, or twice in one invocation
     */
    public static ResumeDecision suspend(Map<String, Object> payload) {
        Scope scope = CURRENT.get();
        if (scope == null) {
            throw new IllegalStateException("suspend() can only be called while a graph node is executing");
        }
        return scope.suspend(payload);
    }

    /**
     * Opens the invocation scope of one node attempt on the current thread.
     *
     * @param decision the decision to hand back on resume, or null on a first execution
     */
    public static Scope open(ResumeDecision decision) {
        Scope scope = new Scope(decision, CURRENT.get());
        CURRENT.set(scope);
        return scope;
    }

    public static final class Scope implements AutoCloseable {

        private final ResumeDecision decision;
        private final Scope previous;
        private boolean suspended;

        private Scope(ResumeDecision decision, Scope previous) {
            this.decision = decision;
            this.previous = previous;
        }

        private ResumeDecision suspend(Map<String, Object> payload) {
            if (suspended) {
                throw new IllegalStateException("A node may suspend at most once per invocation");
            }
            suspended = true;
            if (decision != null) {
                return decision;
            }
            throw new NodeInterrupt(payload != null ? payload : Map.of());
        }

        @Override
        public void close() {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        }
    }
}
