package com.newsflow.publishing;

import com.newsflow.core.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All article sources known to the application: {@link ArticleSource} beans plus
 * one {@link FeedArticleSource} per entry of {@code newsflow.pipeline.feeds}.
 */
@Component
public class ArticleSourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ArticleSourceRegistry.class);

    private final Map<String, ArticleSource> sources = new LinkedHashMap<>();
    private final List<String> active;

    public ArticleSourceRegistry(List<ArticleSource> beans, PipelineProperties properties) {
        beans.forEach(this::add);
        properties.getFeeds().forEach((name, url) -> add(new FeedArticleSource(name, url)));

        List<String> configured = properties.getSources();
        if (configured == null || configured.isEmpty()) {
            this.active = List.copyOf(sources.keySet());
        } else {
            for (String name : configured) {
                if (!sources.containsKey(name)) {
                    throw new IllegalArgumentException("Unknown article source '" + name
                            + "'; registered: " + sources.keySet());
                }
            }
            this.active = List.copyOf(configured);
        }
        log.info("Article sources: {} (active: {})", sources.keySet(), active);
    }

    private void add(ArticleSource source) {
        if (sources.putIfAbsent(source.name(), source) != null) {
            throw new IllegalArgumentException("Duplicate article source '" + source.name() + "'");
        }
    }

    public Optional<ArticleSource> lookup(String name) {
        return Optional.ofNullable(sources.get(name));
    }

    /** Sources scraped by every run, in launch order. */
    public List<String> activeSources() {
        return new ArrayList<>(active);
    }
}
