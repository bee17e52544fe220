package com.newsflow.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * An article collected by one of the sources.
 *
 * @param source           origin tag, e.g. "feed:techcrunch"
 * @param publishedAt      ISO-8601 timestamp as reported by the source
 * @param credibilityScore 0.0-1.0, filled in by the credibility node
 * @param category         topic assigned by the analyze node, null until then
 * @param relevanceScore   0.0-1.0 importance for practitioners, neutral until analyzed
 */
public record NewsArticle(
    String title,
    String url,
    String source,
    String content,
    String publishedAt,
    double credibilityScore,
    String category,
    double relevanceScore
) implements Serializable {

    public static final double NEUTRAL_RELEVANCE = 0.5;

    /** A freshly scraped article that has not been analyzed yet. */
    public NewsArticle(String title, String url, String source, String content,
                       String publishedAt, double credibilityScore) {
        this(title, url, source, content, publishedAt, credibilityScore, null, NEUTRAL_RELEVANCE);
    }

    public NewsArticle withCredibilityScore(double score) {
        return new NewsArticle(title, url, source, content, publishedAt, score, category, relevanceScore);
    }

    public NewsArticle withAnalysis(String category, double relevanceScore) {
        return new NewsArticle(title, url, source, content, publishedAt, credibilityScore, category, relevanceScore);
    }

    /**
     * Rebuilds an article from its checkpointed map form.
     */
    public static NewsArticle fromMap(Map<?, ?> map) {
        return new NewsArticle(
                (String) map.get("title"),
                (String) map.get("url"),
                (String) map.get("source"),
                (String) map.get("content"),
                (String) map.get("publishedAt"),
                map.get("credibilityScore") instanceof Number n ? n.doubleValue() : 0.0,
                (String) map.get("category"),
                map.get("relevanceScore") instanceof Number r ? r.doubleValue() : NEUTRAL_RELEVANCE);
    }
}
