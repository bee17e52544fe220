package com.newsflow.core.state;

import com.newsflow.core.model.ApprovalStatus;
import com.newsflow.core.model.NewsArticle;
import com.newsflow.core.model.Summary;
import com.newsflow.core.model.TriggerType;

import java.util.List;
import java.util.Map;

/**
 * State of the news pipeline graph.
 * <p>
 * Adds typed accessors for every field of a run. {@code rawArticles} and
 * {@code errorLog} use append channels so parallel scrapers and failing nodes can
 * contribute entries without replacing each other's. Values restored from a
 * durable checkpoint arrive as plain maps and are converted back on access.
 */
public class PipelineState extends GraphState {

    public static final Map<String, Channel> SCHEMA = Map.ofEntries(
        // ── Run metadata ─────────────────────────────────────────────
        Map.entry("runId",                Channels.overwrite(() -> "")),
        Map.entry("triggerType",          Channels.overwrite(() -> TriggerType.MANUAL.name())),
        Map.entry("currentStep",          Channels.overwrite(() -> "starting")),

        // ── Data pipeline ────────────────────────────────────────────
        Map.entry("sourceName",           Channels.overwrite(() -> "")),
        Map.entry("deduplicatedArticles", Channels.overwrite(List::of)),
        Map.entry("summaries",            Channels.overwrite(List::of)),

        // ── Content generation ───────────────────────────────────────
        Map.entry("newsletterHtml",       Channels.overwrite(() -> "")),
        Map.entry("linkedinDraft",        Channels.overwrite(() -> "")),
        Map.entry("imagePaths",           Channels.overwrite(List::of)),

        // ── Human review ─────────────────────────────────────────────
        Map.entry("approvalStatus",       Channels.overwrite(() -> ApprovalStatus.PENDING.name())),
        Map.entry("feedback",             Channels.overwrite(() -> "")),
        Map.entry("revisionCount",        Channels.overwrite(() -> 0)),

        // ── Appender channels ────────────────────────────────────────
        Map.entry("rawArticles",          Channels.append()),
        Map.entry("errorLog",             Channels.append())
    );

    public PipelineState(Map<String, Object> initData) {
        super(initData);
    }

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public TriggerType triggerType() {
        String raw = this.<String>value("triggerType").orElse(TriggerType.MANUAL.name());
        return TriggerType.valueOf(raw);
    }

    public String currentStep() {
        return this.<String>value("currentStep").orElse("");
    }

    /** Source assigned to a scrape branch by the fan-out edge. */
    public String sourceName() {
        return this.<String>value("sourceName").orElse("");
    }

    public List<NewsArticle> rawArticles() {
        return articles("rawArticles");
    }

    public List<NewsArticle> deduplicatedArticles() {
        return articles("deduplicatedArticles");
    }

    public List<Summary> summaries() {
        List<?> raw = this.<List<?>>value("summaries").orElse(List.of());
        return raw.stream()
                .map(obj -> obj instanceof Summary s ? s : Summary.fromMap((Map<?, ?>) obj))
                .toList();
    }

    public String newsletterHtml() {
        return this.<String>value("newsletterHtml").orElse("");
    }

    public String linkedinDraft() {
        return this.<String>value("linkedinDraft").orElse("");
    }

    public List<String> imagePaths() {
        return this.<List<String>>value("imagePaths").orElse(List.of());
    }

    public ApprovalStatus approvalStatus() {
        String raw = this.<String>value("approvalStatus").orElse(ApprovalStatus.PENDING.name());
        return ApprovalStatus.valueOf(raw);
    }

    public String feedback() {
        return this.<String>value("feedback").orElse("");
    }

    public int revisionCount() {
        return this.<Number>value("revisionCount").map(Number::intValue).orElse(0);
    }

    public List<String> errorLog() {
        return this.<List<?>>value("errorLog").orElse(List.of()).stream()
                .map(String::valueOf)
                .toList();
    }

    private List<NewsArticle> articles(String key) {
        List<?> raw = this.<List<?>>value(key).orElse(List.of());
        return raw.stream()
                .map(obj -> obj instanceof NewsArticle a ? a : NewsArticle.fromMap((Map<?, ?>) obj))
                .toList();
    }
}
