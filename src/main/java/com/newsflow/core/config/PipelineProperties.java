package com.newsflow.core.config;

import com.newsflow.core.retry.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings of the news pipeline, bound from {@code newsflow.pipeline.*}.
 */
@Component
@ConfigurationProperties(prefix = "newsflow.pipeline")
public class PipelineProperties {

    /**
     * Article sources scraped in parallel at the start of every run. Empty means
     * every registered source.
     */
    private List<String> sources = new ArrayList<>();

    /** RSS/Atom feeds registered as article sources, keyed by source name. */
    private Map<String, String> feeds = new LinkedHashMap<>();

    private double credibilityThreshold = 0.4;
    private int maxArticlesPerRun = 200;
    private ScraperRetry scraperRetry = new ScraperRetry();

    public List<String> getSources() { return sources; }
    public void setSources(List<String> sources) { this.sources = sources; }
    public Map<String, String> getFeeds() { return feeds; }
    public void setFeeds(Map<String, String> feeds) { this.feeds = feeds; }
    public double getCredibilityThreshold() { return credibilityThreshold; }
    public void setCredibilityThreshold(double credibilityThreshold) { this.credibilityThreshold = credibilityThreshold; }
    public int getMaxArticlesPerRun() { return maxArticlesPerRun; }
    public void setMaxArticlesPerRun(int maxArticlesPerRun) { this.maxArticlesPerRun = maxArticlesPerRun; }
    public ScraperRetry getScraperRetry() { return scraperRetry; }
    public void setScraperRetry(ScraperRetry scraperRetry) { this.scraperRetry = scraperRetry; }

    public static class ScraperRetry {
        private int maxAttempts = 3;
        private Duration initialInterval = Duration.ofSeconds(2);
        private double backoffFactor = 2.0;
        private boolean jitter = true;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialInterval() { return initialInterval; }
        public void setInitialInterval(Duration initialInterval) { this.initialInterval = initialInterval; }
        public double getBackoffFactor() { return backoffFactor; }
        public void setBackoffFactor(double backoffFactor) { this.backoffFactor = backoffFactor; }
        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, initialInterval, backoffFactor, jitter);
        }
    }
}
