package com.newsflow.core.nodes;

import com.newsflow.core.state.PipelineState;
import com.newsflow.publishing.NewsletterRenderer;
import com.newsflow.publishing.Publication;
import com.newsflow.publishing.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Sends the approved newsletter. A delivery failure is logged and recorded but
 * does not fail the run.
 */
@Component
public class PublishNode {

    private static final Logger log = LoggerFactory.getLogger(PublishNode.class);

    static final String SUBJECT = "Your AI/ML Weekly Digest";

    private final Publisher publisher;
    private final NewsletterRenderer renderer;

    public PublishNode(Publisher publisher, NewsletterRenderer renderer) {
        this.publisher = publisher;
        this.renderer = renderer;
    }

    public Map<String, Object> apply(PipelineState state) {
        String runId = state.runId();
        String html = renderer.render(runId, state.summaries());
        log.info("Publishing run {}: {} summaries, {} chars post",
                runId, state.summaries().size(), state.linkedinDraft().length());

        try {
            publisher.publish(new Publication(runId, SUBJECT, html, state.linkedinDraft(), state.imagePaths()));
            log.info("Newsletter sent for run {}", runId);
        } catch (Exception e) {
            log.error("Newsletter delivery failed for run {}: {}", runId, e.getMessage(), e);
            return Map.of(
                    "newsletterHtml", html,
                    "errorLog", List.of("Publish: " + e.getMessage()),
                    "currentStep", "published");
        }
        return Map.of("newsletterHtml", html, "currentStep", "published");
    }
}
