package com.newsflow.publishing;

import com.newsflow.core.model.ArticleAnalysis;
import com.newsflow.core.model.NewsArticle;
import com.newsflow.core.model.Summary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Content generator that needs no model backend: topics and relevance come from
 * keyword matches, headlines from article titles and bodies from their leading sentences.
 */
public class TemplateContentGenerator implements ContentGenerator {

    private static final Logger log = LoggerFactory.getLogger(TemplateContentGenerator.class);

    static final int MAX_HEADLINE = 80;
    static final int MAX_BODY = 280;
    static final int MAX_POST_ITEMS = 7;
    static final int MAX_POST_LENGTH = 3000;
    private static final String HASHTAGS = "#AI #MachineLearning #TechNews";

    static final double BASE_RELEVANCE = 0.3;
    static final double RELEVANCE_PER_TERM = 0.15;
    private static final int CLASSIFY_CONTENT_CHARS = 500;

    // First matching category wins.
    private static final List<Map.Entry<String, List<String>>> CATEGORY_KEYWORDS = List.of(
            Map.entry("Research Paper", List.of("arxiv", "paper", "we propose", "benchmark", "preprint")),
            Map.entry("AI Policy", List.of("regulation", "policy", "law", "ai act", "government", "senate", "ban")),
            Map.entry("AI Startup", List.of("startup", "raises", "funding", "series a", "series b", "seed round")),
            Map.entry("Robotics", List.of("robot", "robots", "robotics", "humanoid", "drone")),
            Map.entry("Computer Vision", List.of("vision", "image", "video", "diffusion", "segmentation")),
            Map.entry("LLM", List.of("llm", "llms", "language model", "gpt", "chatbot", "transformer", "gemini", "llama")),
            Map.entry("Industry News", List.of("launch", "launches", "announces", "release", "released", "partnership", "acquires"))
    );

    private static final List<String> AI_TERMS = List.of(
            "ai", "artificial intelligence", "machine learning", "deep learning", "neural", "model",
            "llm", "agent", "training", "inference", "dataset", "gpu");

    @Override
    public List<ArticleAnalysis> classify(List<NewsArticle> articles) {
        List<ArticleAnalysis> results = new ArrayList<>(articles.size());
        for (int i = 0; i < articles.size(); i++) {
            NewsArticle article = articles.get(i);
            String text = words(article.title() + " " + leading(article.content()) + " " + article.url());
            results.add(new ArticleAnalysis(i, category(text), relevance(text)));
        }
        return results;
    }

    static String category(String words) {
        for (Map.Entry<String, List<String>> entry : CATEGORY_KEYWORDS) {
            if (entry.getValue().stream().anyMatch(k -> words.contains(" " + k + " "))) {
                return entry.getKey();
            }
        }
        return ArticleAnalysis.OTHER;
    }

    static double relevance(String words) {
        long hits = AI_TERMS.stream().filter(t -> words.contains(" " + t + " ")).count();
        double score = Math.min(1.0, BASE_RELEVANCE + RELEVANCE_PER_TERM * hits);
        return Math.round(score * 1000.0) / 1000.0;
    }

    /** Lower-cased words separated by single spaces, padded so every word has a space on both sides. */
    static String words(String text) {
        return " " + text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").strip() + " ";
    }

    private static String leading(String content) {
        if (content == null) return "";
        return content.length() <= CLASSIFY_CONTENT_CHARS ? content : content.substring(0, CLASSIFY_CONTENT_CHARS);
    }

    @Override
    public List<Summary> summarize(List<NewsArticle> articles, String feedback) {
        if (feedback != null && !feedback.isBlank()) {
            log.info("Regenerating {} summaries with reviewer feedback: {}", articles.size(), feedback);
        }
        return articles.stream()
                .map(a -> new Summary(
                        truncate(a.title(), MAX_HEADLINE),
                        leadingSentences(a.content()),
                        a.category() != null ? a.category() : "Industry",
                        List.of(a.url()),
                        a.credibilityScore()))
                .toList();
    }

    @Override
    public String draftPost(List<Summary> summaries, String feedback) {
        if (summaries.isEmpty()) {
            return "";
        }
        var post = new StringBuilder();
        post.append("This week in AI: ").append(summaries.get(0).headline()).append("\n\n");
        summaries.stream()
                .limit(MAX_POST_ITEMS)
                .forEach(s -> post.append("→ ").append(s.headline()).append('\n'));
        post.append("\nWhich of these will matter most a year from now?\n\n").append(HASHTAGS);

        String draft = post.toString();
        if (draft.length() > MAX_POST_LENGTH) {
            log.warn("LinkedIn draft too long ({} chars), truncating", draft.length());
            draft = draft.substring(0, MAX_POST_LENGTH - 50) + "\n\n#AI #MachineLearning";
        }
        return draft;
    }

    private static String leadingSentences(String content) {
        if (content == null || content.isBlank()) {
            return "";
        }
        String text = content.strip().replaceAll("\\s+", " ");
        int end = -1;
        for (int i = 0, found = 0; i < text.length() && found < 2; i++) {
            char c = text.charAt(i);
            if ((c == '.' || c == '!' || c == '?') && (i + 1 == text.length() || text.charAt(i + 1) == ' ')) {
                end = i + 1;
                found++;
            }
        }
        return truncate(end > 0 ? text.substring(0, end) : text, MAX_BODY);
    }

    private static String truncate(String value, int max) {
        if (value == null) return "";
        return value.length() <= max ? value : value.substring(0, max - 3).stripTrailing() + "...";
    }
}
