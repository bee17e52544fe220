package com.newsflow.core.nodes;

import com.newsflow.core.model.NewsArticle;
import com.newsflow.core.state.PipelineState;
import com.newsflow.publishing.ArticleSource;
import com.newsflow.publishing.ArticleSourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Fan-out branch that collects articles from one source.
 *
 * <p>The source is chosen by the {@code sourceName} argument of the branch. Fetch
 * errors propagate so the scraper retry policy can try again; every branch
 * contributes to the shared {@code rawArticles} append field.
 */
@Component
public class ScrapeNode {

    private static final Logger log = LoggerFactory.getLogger(ScrapeNode.class);

    private final ArticleSourceRegistry sources;

    public ScrapeNode(ArticleSourceRegistry sources) {
        this.sources = sources;
    }

    public Map<String, Object> apply(PipelineState state) throws Exception {
        String name = state.sourceName();
        ArticleSource source = sources.lookup(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown article source '" + name + "'"));

        List<NewsArticle> articles = source.fetch();
        log.info("Source {} returned {} articles", name, articles.size());
        return Map.of("rawArticles", articles);
    }
}
