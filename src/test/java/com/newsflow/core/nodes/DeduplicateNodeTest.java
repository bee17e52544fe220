package com.newsflow.core.nodes;

import com.newsflow.core.model.NewsArticle;
import com.newsflow.core.state.PipelineState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeduplicateNodeTest {

    private final DeduplicateNode node = new DeduplicateNode();

    private static NewsArticle article(String title, String content, String source) {
        return new NewsArticle(title, "https://example.com/" + title.hashCode(), source, content, null, 0.0);
    }

    @Test
    @DisplayName("drops repeated content and repeated titles, keeping the first occurrence")
    void removesDuplicates() {
        var first = article("GPT-5 launches", "Body one", "feed:a");
        var sameContent = article("Different title", "Body one", "feed:b");
        var sameTitle = article("  gpt-5 LAUNCHES ", "Body two", "feed:c");
        var unique = article("Robotics funding", "Body three", "feed:a");

        Map<String, Object> update = node.apply(new PipelineState(Map.of(
                "rawArticles", List.of(first, sameContent, sameTitle, unique))));

        assertEquals(List.of(first, unique), update.get("deduplicatedArticles"));
        assertEquals("deduplicated", update.get("currentStep"));
    }

    @Test
    @DisplayName("empty input produces an empty list")
    void emptyInput() {
        Map<String, Object> update = node.apply(new PipelineState(Map.of()));
        assertEquals(List.of(), update.get("deduplicatedArticles"));
    }

    @Test
    @DisplayName("content hash is a stable SHA-256 hex digest")
    void contentHash() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                DeduplicateNode.contentHash(""));
        assertEquals(DeduplicateNode.contentHash(null), DeduplicateNode.contentHash(""));
        assertEquals(64, DeduplicateNode.contentHash("news").length());
    }
}
