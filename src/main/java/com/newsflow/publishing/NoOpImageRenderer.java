package com.newsflow.publishing;

import com.newsflow.core.model.Summary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Image renderer used when no rendering backend is configured.
 */
public class NoOpImageRenderer implements ImageRenderer {

    private static final Logger log = LoggerFactory.getLogger(NoOpImageRenderer.class);

    @Override
    public List<String> render(String runId, List<Summary> summaries) {
        log.info("Image rendering disabled; skipping {} cards for run {}", summaries.size(), runId);
        return List.of();
    }
}
