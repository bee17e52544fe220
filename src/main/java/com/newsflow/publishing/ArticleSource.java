package com.newsflow.publishing;

import com.newsflow.core.model.NewsArticle;

import java.util.List;

/**
 * A place articles are collected from. One scrape branch per source runs in
 * every pipeline run; a thrown exception is retried under the scraper retry policy.
 */
public interface ArticleSource {

    /** Unique name used in configuration and as the fan-out branch argument. */
    String name();

    List<NewsArticle> fetch() throws Exception;
}
