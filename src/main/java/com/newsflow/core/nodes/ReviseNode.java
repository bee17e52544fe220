package com.newsflow.core.nodes;

import com.newsflow.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Start of the revision loop: counts the rejection and hands the feedback back
 * to the summarize step.
 */
@Component
public class ReviseNode {

    private static final Logger log = LoggerFactory.getLogger(ReviseNode.class);

    public Map<String, Object> apply(PipelineState state) {
        int revision = state.revisionCount() + 1;
        log.info("Revision {} requested for run {}: {}", revision, state.runId(), state.feedback());
        return Map.of("revisionCount", revision, "currentStep", "revising");
    }
}
