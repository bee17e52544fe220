package com.newsflow.core.nodes;

import com.newsflow.core.state.PipelineState;
import com.newsflow.publishing.ImageRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Renders news cards for the top stories.
 */
@Component
public class ImageGenNode {

    private static final Logger log = LoggerFactory.getLogger(ImageGenNode.class);

    static final int MAX_CARDS = 5;

    private final ImageRenderer renderer;

    public ImageGenNode(ImageRenderer renderer) {
        this.renderer = renderer;
    }

    public Map<String, Object> apply(PipelineState state) throws Exception {
        var summaries = state.summaries();
        if (summaries.isEmpty()) {
            log.info("Image generation skipped: no summaries");
            return Map.of("imagePaths", List.of(), "currentStep", "images_generated");
        }

        List<String> paths = renderer.render(state.runId(),
                summaries.subList(0, Math.min(MAX_CARDS, summaries.size())));
        return Map.of("imagePaths", paths, "currentStep", "images_generated");
    }
}
