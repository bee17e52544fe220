package com.newsflow.core.nodes;

import com.newsflow.core.model.NewsArticle;
import com.newsflow.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Drops articles whose content hash or normalised title was already seen.
 * First occurrence wins, so source launch order decides which copy survives.
 */
@Component
public class DeduplicateNode {

    private static final Logger log = LoggerFactory.getLogger(DeduplicateNode.class);

    public Map<String, Object> apply(PipelineState state) {
        List<NewsArticle> raw = state.rawArticles();
        Set<String> seenHashes = new HashSet<>();
        Set<String> seenTitles = new HashSet<>();
        List<NewsArticle> unique = new ArrayList<>();

        for (NewsArticle article : raw) {
            String hash = contentHash(article.content());
            String title = article.title() == null ? "" : article.title().strip().toLowerCase(Locale.ROOT);
            if (seenHashes.contains(hash) || seenTitles.contains(title)) {
                continue;
            }
            seenHashes.add(hash);
            seenTitles.add(title);
            unique.add(article);
        }

        log.info("Deduplication: {} raw, {} unique, {} removed", raw.size(), unique.size(), raw.size() - unique.size());
        return Map.of("deduplicatedArticles", unique, "currentStep", "deduplicated");
    }

    static String contentHash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((content == null ? "" : content).getBytes(StandardCharsets.UTF_8));
            var hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
