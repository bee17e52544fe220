package com.newsflow.core.nodes;

import com.newsflow.core.config.PipelineProperties;
import com.newsflow.core.model.NewsArticle;
import com.newsflow.core.model.Summary;
import com.newsflow.core.state.PipelineState;
import com.newsflow.publishing.ContentGenerator;
import com.newsflow.publishing.NewsletterRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Ranks the scored articles, keeps the top {@code maxArticlesPerRun} and asks the
 * {@link ContentGenerator} for newsletter summaries. Reviewer feedback from a
 * rejected draft is passed along, which is what makes the revision loop converge.
 */
@Component
public class SummarizeNode {

    private static final Logger log = LoggerFactory.getLogger(SummarizeNode.class);

    private static final double NEUTRAL_RECENCY = 0.5;
    private static final double RECENCY_WINDOW_DAYS = 7.0;

    private final ContentGenerator generator;
    private final NewsletterRenderer renderer;
    private final PipelineProperties properties;
    private final Clock clock;

    @Autowired
    public SummarizeNode(ContentGenerator generator, NewsletterRenderer renderer, PipelineProperties properties) {
        this(generator, renderer, properties, Clock.systemUTC());
    }

    SummarizeNode(ContentGenerator generator, NewsletterRenderer renderer,
                  PipelineProperties properties, Clock clock) {
        this.generator = generator;
        this.renderer = renderer;
        this.properties = properties;
        this.clock = clock;
    }

    public Map<String, Object> apply(PipelineState state) throws Exception {
        List<NewsArticle> articles = state.deduplicatedArticles();
        if (articles.isEmpty()) {
            return Map.of("errorLog", List.of("Summarize: no articles to process"));
        }

        Instant now = clock.instant();
        List<NewsArticle> top = articles.stream()
                .sorted(Comparator.comparingDouble((NewsArticle a) -> rankScore(a, now)).reversed())
                .limit(properties.getMaxArticlesPerRun())
                .toList();

        String feedback = state.feedback();
        List<Summary> summaries = generator.summarize(top, feedback);
        log.info("Summarized {} of {} articles into {} items (revision {})",
                top.size(), articles.size(), summaries.size(), state.revisionCount());

        return Map.of(
                "summaries", summaries,
                "newsletterHtml", renderer.render(state.runId(), summaries),
                "currentStep", "summarized");
    }

    /**
     * 35% credibility + 40% relevance + 25% recency. Relevance is neutral for articles
     * the analyze step did not classify. Recency decays linearly from
     * 1.0 for a fresh article to 0.0 at seven days old.
     */
    static double rankScore(NewsArticle article, Instant now) {
        double recency = NEUTRAL_RECENCY;
        Instant published = parseTimestamp(article.publishedAt());
        if (published != null) {
            double ageDays = Duration.between(published, now).toSeconds() / 86400.0;
            recency = Math.max(0.0, Math.min(1.0, 1.0 - ageDays / RECENCY_WINDOW_DAYS));
        }
        return 0.35 * article.credibilityScore() + 0.40 * article.relevanceScore() + 0.25 * recency;
    }

    static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Character.isDigit(raw.charAt(0))
                    ? OffsetDateTime.parse(raw).toInstant()
                    : ZonedDateTime.parse(raw, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable publication date '{}'", raw);
            return null;
        }
    }
}
