package com.newsflow.core.graph;

import com.newsflow.core.persistence.CheckpointStore;
import com.newsflow.core.persistence.MemoryCheckpointStore;
import com.newsflow.core.retry.RetryPolicyHandler;

import java.util.Objects;

/**
 * Runtime settings bound to a graph at compile time.
 */
public final class CompileConfig {

    public static final int DEFAULT_MAX_PARALLEL = 4;
    public static final String DEFAULT_ERROR_FIELD = "errorLog";

    private final CheckpointStore checkpointStore;
    private final int maxParallel;
    private final String errorField;
    private final RetryPolicyHandler retryHandler;
    private final GraphListener listener;

    private CompileConfig(Builder builder) {
        this.checkpointStore = builder.checkpointStore != null ? builder.checkpointStore : new MemoryCheckpointStore();
        this.maxParallel = builder.maxParallel;
        this.errorField = builder.errorField;
        this.retryHandler = builder.retryHandler != null ? builder.retryHandler : new RetryPolicyHandler();
        this.listener = builder.listener != null ? builder.listener : GraphListener.NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CompileConfig defaults() {
        return builder().build();
    }

    public CheckpointStore checkpointStore() {
        return checkpointStore;
    }

    public int maxParallel() {
        return maxParallel;
    }

    public String errorField() {
        return errorField;
    }

    public RetryPolicyHandler retryHandler() {
        return retryHandler;
    }

    public GraphListener listener() {
        return listener;
    }

    public static final class Builder {

        private CheckpointStore checkpointStore;
        private int maxParallel = DEFAULT_MAX_PARALLEL;
        private String errorField = DEFAULT_ERROR_FIELD;
        private RetryPolicyHandler retryHandler;
        private GraphListener listener;

        private Builder() {}

        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        /** Upper bound on fan-out branches running at once within a superstep. */
        public Builder maxParallel(int maxParallel) {
            if (maxParallel < 1) {
                throw new IllegalArgumentException("maxParallel must be >= 1, got " + maxParallel);
            }
            this.maxParallel = maxParallel;
            return this;
        }

        /** Append-discipline field that receives one entry per failed node invocation. */
        public Builder errorField(String errorField) {
            this.errorField = Objects.requireNonNull(errorField, "errorField must not be null");
            return this;
        }

        public Builder retryHandler(RetryPolicyHandler retryHandler) {
            this.retryHandler = retryHandler;
            return this;
        }

        public Builder listener(GraphListener listener) {
            this.listener = listener;
            return this;
        }

        public CompileConfig build() {
            return new CompileConfig(this);
        }
    }
}
