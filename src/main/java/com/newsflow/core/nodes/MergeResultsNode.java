package com.newsflow.core.nodes;

import com.newsflow.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Join point after the scrape fan-out. The append channel has already combined
 * the branches; this node only records the total.
 */
@Component
public class MergeResultsNode {

    private static final Logger log = LoggerFactory.getLogger(MergeResultsNode.class);

    public Map<String, Object> apply(PipelineState state) {
        log.info("Merged {} raw articles from all sources", state.rawArticles().size());
        return Map.of("currentStep", "merged");
    }
}
