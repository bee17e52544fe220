package com.newsflow.core.nodes;

import com.newsflow.core.config.PipelineProperties;
import com.newsflow.core.model.NewsArticle;
import com.newsflow.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores each article's credibility.
 *
 * <p>Composite score = 0.4 * source reputation + 0.3 * cross-reference + 0.3 * factual
 * consistency. Only the reputation layer is implemented; the other two contribute a
 * neutral 0.5. Articles under the threshold are counted, not removed.
 */
@Component
public class CredibilityNode {

    private static final Logger log = LoggerFactory.getLogger(CredibilityNode.class);

    static final double DEFAULT_REPUTATION = 0.40;
    private static final double NEUTRAL = 0.5;

    static final Map<String, Double> SOURCE_REPUTATION = Map.ofEntries(
        // Established tech journalism
        Map.entry("techcrunch.com", 0.85),
        Map.entry("venturebeat.com", 0.80),
        Map.entry("theverge.com", 0.82),
        Map.entry("wired.com", 0.85),
        Map.entry("arstechnica.com", 0.88),
        Map.entry("technologyreview.com", 0.90),
        // Major news
        Map.entry("reuters.com", 0.95),
        Map.entry("bbc.com", 0.92),
        Map.entry("nytimes.com", 0.90),
        Map.entry("washingtonpost.com", 0.88),
        // Blogs and aggregators
        Map.entry("thenewstack.io", 0.72),
        Map.entry("medium.com", 0.50),
        Map.entry("towardsdatascience.com", 0.55),
        Map.entry("dev.to", 0.45),
        // Research
        Map.entry("arxiv.org", 0.80),
        Map.entry("openreview.net", 0.82),
        Map.entry("nature.com", 0.95),
        Map.entry("science.org", 0.95)
    );

    private final PipelineProperties properties;

    public CredibilityNode(PipelineProperties properties) {
        this.properties = properties;
    }

    public Map<String, Object> apply(PipelineState state) {
        List<NewsArticle> articles = state.deduplicatedArticles();
        if (articles.isEmpty()) {
            return Map.of("errorLog", List.of("Credibility: no articles to score"));
        }

        List<NewsArticle> scored = articles.stream()
                .map(a -> a.withCredibilityScore(score(a.url())))
                .toList();

        long aboveThreshold = scored.stream()
                .filter(a -> a.credibilityScore() >= properties.getCredibilityThreshold())
                .count();
        log.info("Credibility scored {} articles, {} at or above threshold {}",
                scored.size(), aboveThreshold, properties.getCredibilityThreshold());

        return Map.of("deduplicatedArticles", scored, "currentStep", "credibility_scored");
    }

    static double score(String url) {
        double composite = 0.4 * reputation(url) + 0.3 * NEUTRAL + 0.3 * NEUTRAL;
        return Math.round(composite * 1000.0) / 1000.0;
    }

    /**
     * Reputation of the article's domain: exact match first, then the parent domain.
     */
    static double reputation(String url) {
        String host;
        try {
            host = url == null ? null : URI.create(url.strip()).getHost();
        } catch (IllegalArgumentException e) {
            return DEFAULT_REPUTATION;
        }
        if (host == null) {
            return DEFAULT_REPUTATION;
        }
        String domain = host.toLowerCase(Locale.ROOT);
        if (domain.startsWith("www.")) {
            domain = domain.substring(4);
        }

        Double exact = SOURCE_REPUTATION.get(domain);
        if (exact != null) {
            return exact;
        }
        String[] parts = domain.split("\\.");
        if (parts.length > 2) {
            String parent = parts[parts.length - 2] + "." + parts[parts.length - 1];
            return SOURCE_REPUTATION.getOrDefault(parent, DEFAULT_REPUTATION);
        }
        return DEFAULT_REPUTATION;
    }
}
