package com.newsflow.publishing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default collaborators for the content steps. Each is replaced by declaring a
 * bean of the same type.
 */
@Configuration
public class PublishingConfig {

    private static final Logger log = LoggerFactory.getLogger(PublishingConfig.class);

    @Bean
    @ConditionalOnMissingBean(ContentGenerator.class)
    public ContentGenerator templateContentGenerator() {
        log.info("No ContentGenerator configured; using template-based generator");
        return new TemplateContentGenerator();
    }

    @Bean
    @ConditionalOnMissingBean(ImageRenderer.class)
    public ImageRenderer noOpImageRenderer() {
        return new NoOpImageRenderer();
    }

    @Bean
    @ConditionalOnMissingBean(Publisher.class)
    public Publisher loggingPublisher() {
        log.info("No Publisher configured; approved newsletters will only be logged");
        return new LoggingPublisher();
    }
}
