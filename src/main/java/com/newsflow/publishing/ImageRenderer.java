package com.newsflow.publishing;

import com.newsflow.core.model.Summary;

import java.util.List;

/**
 * Renders news card images and returns the paths of the written files.
 */
public interface ImageRenderer {

    List<String> render(String runId, List<Summary> summaries) throws Exception;
}
