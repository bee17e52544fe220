package com.newsflow.publishing;

/**
 * Delivers an approved newsletter. Delivery is at-least-once: a publish step that
 * is re-executed after a crash may call this again for the same run.
 */
public interface Publisher {

    void publish(Publication publication) throws Exception;
}
