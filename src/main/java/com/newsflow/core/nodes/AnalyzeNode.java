package com.newsflow.core.nodes;

import com.newsflow.core.model.ArticleAnalysis;
import com.newsflow.core.model.NewsArticle;
import com.newsflow.core.state.PipelineState;
import com.newsflow.publishing.ContentGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assigns each article a topic and a relevance score, which the summarize step
 * ranks on. Only the first {@link #MAX_BATCH} articles are classified; the rest keep
 * neutral relevance. A classifier failure is recorded and the run carries on unranked.
 */
@Component
public class AnalyzeNode {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeNode.class);

    static final int MAX_BATCH = 50;

    private final ContentGenerator generator;

    public AnalyzeNode(ContentGenerator generator) {
        this.generator = generator;
    }

    public Map<String, Object> apply(PipelineState state) {
        List<NewsArticle> articles = state.deduplicatedArticles();
        if (articles.isEmpty()) {
            return Map.of("errorLog", List.of("Analyze: no articles to process"));
        }

        List<NewsArticle> batch = articles.subList(0, Math.min(MAX_BATCH, articles.size()));
        List<ArticleAnalysis> analyses;
        try {
            analyses = generator.classify(batch);
        } catch (Exception e) {
            log.error("Article classification failed: {}", e.getMessage(), e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return Map.of("errorLog", List.of("Analyze: " + reason), "currentStep", "analyzed");
        }

        List<NewsArticle> enriched = new ArrayList<>(articles);
        int applied = 0;
        for (ArticleAnalysis analysis : analyses) {
            int index = analysis.index();
            if (index < 0 || index >= batch.size()) {
                log.debug("Ignoring classification for out-of-range index {}", index);
                continue;
            }
            enriched.set(index, enriched.get(index).withAnalysis(
                    normalizeCategory(analysis.category()), clamp(analysis.relevanceScore())));
            applied++;
        }

        log.info("Analyzed {} of {} articles", applied, articles.size());
        return Map.of("deduplicatedArticles", enriched, "currentStep", "analyzed");
    }

    static String normalizeCategory(String category) {
        return ArticleAnalysis.CATEGORIES.contains(category) ? category : ArticleAnalysis.OTHER;
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return NewsArticle.NEUTRAL_RELEVANCE;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
