package com.newsflow.core.model;

import java.util.List;

/**
 * Topic and relevance assigned to one article.
 *
 * @param index          position of the article in the classified batch
 * @param category       one of {@link #CATEGORIES}
 * @param relevanceScore 0.0-1.0
 */
public record ArticleAnalysis(int index, String category, double relevanceScore) {

    public static final String OTHER = "Other";

    public static final List<String> CATEGORIES = List.of(
            "LLM", "Computer Vision", "Robotics", "AI Policy", "AI Startup",
            "Research Paper", "Industry News", OTHER);
}
