package com.newsflow.publishing;

import java.util.List;

/**
 * Approved content handed to a {@link Publisher}.
 */
public record Publication(
    String runId,
    String subject,
    String newsletterHtml,
    String linkedinDraft,
    List<String> imagePaths
) {

    public Publication {
        imagePaths = imagePaths == null ? List.of() : List.copyOf(imagePaths);
    }
}
