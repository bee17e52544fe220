package com.newsflow.publishing;

import com.newsflow.core.config.PipelineProperties;
import com.newsflow.core.model.NewsArticle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArticleSourceRegistryTest {

    private PipelineProperties properties;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
    }

    private static ArticleSource source(String name) {
        return new ArticleSource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<NewsArticle> fetch() {
                return List.of();
            }
        };
    }

    @Test
    void allSourcesAreActiveWhenNoneConfigured() {
        properties.setFeeds(Map.of("hackernews", "https://hnrss.org/newest?q=AI"));

        var registry = new ArticleSourceRegistry(List.of(source("arxiv")), properties);

        assertEquals(List.of("arxiv", "hackernews"), registry.activeSources());
        assertInstanceOf(FeedArticleSource.class, registry.lookup("hackernews").orElseThrow());
    }

    @Test
    void configuredSourcesKeepTheirOrder() {
        properties.setSources(List.of("b", "a"));

        var registry = new ArticleSourceRegistry(List.of(source("a"), source("b"), source("c")), properties);

        assertEquals(List.of("b", "a"), registry.activeSources());
        assertTrue(registry.lookup("c").isPresent());
        assertTrue(registry.lookup("missing").isEmpty());
    }

    @Test
    void unknownConfiguredSourceIsRejected() {
        properties.setSources(List.of("arxiv", "reddit"));

        var error = assertThrows(IllegalArgumentException.class,
                () -> new ArticleSourceRegistry(List.of(source("arxiv")), properties));
        assertTrue(error.getMessage().contains("reddit"));
    }

    @Test
    void duplicateNamesAreRejected() {
        properties.setFeeds(Map.of("arxiv", "https://rss.arxiv.org/rss/cs.AI"));

        assertThrows(IllegalArgumentException.class,
                () -> new ArticleSourceRegistry(List.of(source("arxiv")), properties));
    }

    @Test
    void activeSourcesIsACopy() {
        var registry = new ArticleSourceRegistry(List.of(source("a")), properties);
        registry.activeSources().clear();
        assertEquals(List.of("a"), registry.activeSources());
    }
}
