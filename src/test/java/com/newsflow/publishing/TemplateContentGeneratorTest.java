package com.newsflow.publishing;

import com.newsflow.core.model.ArticleAnalysis;
import com.newsflow.core.model.NewsArticle;
import com.newsflow.core.model.Summary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class TemplateContentGeneratorTest {

    private final TemplateContentGenerator generator = new TemplateContentGenerator();

    @Test
    @DisplayName("summaries take the title and the first two sentences")
    void summarize() {
        var article = new NewsArticle("Lab releases open weights", "https://example.com/a", "feed:x",
                "  The lab released weights.   Benchmarks look strong! Pricing was not disclosed.", null, 0.72);

        Summary summary = generator.summarize(List.of(article), "").get(0);

        assertEquals("Lab releases open weights", summary.headline());
        assertEquals("The lab released weights. Benchmarks look strong!", summary.body());
        assertEquals(List.of("https://example.com/a"), summary.sourceUrls());
        assertEquals(0.72, summary.credibilityScore());
    }

    @Test
    @DisplayName("summaries carry the analyzed category")
    void summarizeUsesCategory() {
        var article = new NewsArticle("Lab releases open weights", "https://example.com/a", "feed:x",
                "Weights are out.", null, 0.72).withAnalysis("LLM", 0.9);

        assertEquals("LLM", generator.summarize(List.of(article), "").get(0).category());
    }

    @Test
    @DisplayName("classify picks the first matching topic and scores AI terms")
    void classify() {
        List<ArticleAnalysis> analyses = generator.classify(List.of(
                new NewsArticle("OpenAI launches new language model", "https://example.com/a", "feed:x",
                        "The GPT model beats prior benchmarks.", null, 0.5),
                new NewsArticle("EU passes AI Act", "https://example.com/b", "feed:x",
                        "New law regulates machine learning and artificial intelligence systems.", null, 0.5),
                new NewsArticle("Gardening tips", "https://example.com/c", "feed:x",
                        "Water your plants.", null, 0.5)));

        assertEquals(List.of(0, 1, 2), analyses.stream().map(ArticleAnalysis::index).toList());
        assertEquals(List.of("LLM", "AI Policy", "Other"),
                analyses.stream().map(ArticleAnalysis::category).toList());
        assertEquals(0.45, analyses.get(0).relevanceScore(), 1e-9);
        assertEquals(0.75, analyses.get(1).relevanceScore(), 1e-9);
        assertEquals(TemplateContentGenerator.BASE_RELEVANCE, analyses.get(2).relevanceScore(), 1e-9);
    }

    @Test
    @DisplayName("relevance is capped at 1.0")
    void relevanceCap() {
        String words = TemplateContentGenerator.words("AI model training, inference on GPU; agent dataset neural");

        assertEquals(1.0, TemplateContentGenerator.relevance(words));
        assertEquals("Other", TemplateContentGenerator.category(words));
    }

    @Test
    @DisplayName("keywords match whole words only")
    void wholeWords() {
        assertEquals("Other", TemplateContentGenerator.category(TemplateContentGenerator.words("Lawn impact report")));
        assertEquals("AI Policy", TemplateContentGenerator.category(TemplateContentGenerator.words("New AI Act draft")));
    }

    @Test
    @DisplayName("long titles are truncated with an ellipsis")
    void truncatesHeadline() {
        var article = new NewsArticle("x".repeat(120), "https://example.com/a", "feed:x", "", null, 0.5);

        Summary summary = generator.summarize(List.of(article), null).get(0);

        assertEquals(TemplateContentGenerator.MAX_HEADLINE, summary.headline().length());
        assertTrue(summary.headline().endsWith("..."));
        assertEquals("", summary.body());
    }

    @Test
    @DisplayName("the post leads with the top story and lists at most seven headlines")
    void draftPost() {
        List<Summary> summaries = IntStream.range(0, 10)
                .mapToObj(i -> new Summary("Story " + i, "", "Research", List.of(), 0.5))
                .toList();

        String post = generator.draftPost(summaries, "");

        assertTrue(post.startsWith("This week in AI: Story 0\n\n"));
        assertTrue(post.contains("→ Story 6\n"));
        assertFalse(post.contains("Story 7"));
        assertTrue(post.endsWith("#AI #MachineLearning #TechNews"));
    }

    @Test
    void emptyPost() {
        assertEquals("", generator.draftPost(List.of(), ""));
    }
}
