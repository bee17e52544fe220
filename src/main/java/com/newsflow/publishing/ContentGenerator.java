package com.newsflow.publishing;

import com.newsflow.core.model.ArticleAnalysis;
import com.newsflow.core.model.NewsArticle;
import com.newsflow.core.model.Summary;

import java.util.List;

/**
 * Classifies articles and turns ranked articles into newsletter summaries and a social post.
 */
public interface ContentGenerator {

    /**
     * Assigns a topic and a relevance score to articles of the batch. Entries refer to
     * articles by their {@link ArticleAnalysis#index()}; articles without an entry keep
     * their current values.
     */
    List<ArticleAnalysis> classify(List<NewsArticle> articles) throws Exception;

    /**
     * @param feedback reviewer feedback from a rejected draft, empty on the first pass
     */
    List<Summary> summarize(List<NewsArticle> articles, String feedback) throws Exception;

    String draftPost(List<Summary> summaries, String feedback) throws Exception;
}
