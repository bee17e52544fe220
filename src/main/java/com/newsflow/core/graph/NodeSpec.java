package com.newsflow.core.graph;

import com.newsflow.core.retry.RetryPolicy;
import com.newsflow.core.state.GraphState;

import java.util.Objects;

/**
 * Registered node: its unique name, its behavior, and the retry policy applied to
 * each invocation.
 */
public record NodeSpec<S extends GraphState>(String name, NodeAction<S> action, RetryPolicy retryPolicy) {

    public NodeSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(action, "action must not be null");
        retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.NONE;
    }
}
