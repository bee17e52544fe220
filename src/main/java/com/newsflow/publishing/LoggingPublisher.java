package com.newsflow.publishing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publisher that only logs what would have been sent.
 */
public class LoggingPublisher implements Publisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingPublisher.class);

    @Override
    public void publish(Publication publication) {
        log.info("Publishing run {}: '{}' ({} chars html, {} chars post, {} images)",
                publication.runId(), publication.subject(), publication.newsletterHtml().length(),
                publication.linkedinDraft().length(), publication.imagePaths().size());
    }
}
