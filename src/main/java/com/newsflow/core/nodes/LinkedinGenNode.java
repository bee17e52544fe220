package com.newsflow.core.nodes;

import com.newsflow.core.state.PipelineState;
import com.newsflow.publishing.ContentGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Drafts the LinkedIn post from the current summaries.
 */
@Component
public class LinkedinGenNode {

    private static final Logger log = LoggerFactory.getLogger(LinkedinGenNode.class);

    private final ContentGenerator generator;

    public LinkedinGenNode(ContentGenerator generator) {
        this.generator = generator;
    }

    public Map<String, Object> apply(PipelineState state) throws Exception {
        var summaries = state.summaries();
        if (summaries.isEmpty()) {
            return Map.of("errorLog", List.of("LinkedIn gen: no content to work with"));
        }

        String draft = generator.draftPost(summaries, state.feedback());
        log.info("LinkedIn draft generated ({} chars)", draft.length());
        return Map.of("linkedinDraft", draft, "currentStep", "linkedin_generated");
    }
}
