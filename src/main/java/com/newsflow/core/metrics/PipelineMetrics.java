package com.newsflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline execution.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSuperstep(int taskCount, long ms) {
        Timer.builder("newsflow.superstep.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));

        DistributionSummary.builder("newsflow.superstep.tasks")
                .description("Node invocations per superstep")
                .register(registry)
                .record(taskCount);
    }

    public void recordNodeRetry(String node) {
        Counter.builder("newsflow.node.retries")
                .tag("node", node)
                .register(registry)
                .increment();
    }

    public void recordNodeFailure(String node) {
        Counter.builder("newsflow.node.failures")
                .description("Node invocations that exhausted their retry policy")
                .tag("node", node)
                .register(registry)
                .increment();
    }

    public void recordInterrupt(String node) {
        Counter.builder("newsflow.runs.interrupts")
                .tag("node", node)
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status) {
        Counter.builder("newsflow.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRevisionDepth(int revisions) {
        DistributionSummary.builder("newsflow.runs.revisions")
                .register(registry)
                .record(revisions);
    }
}
