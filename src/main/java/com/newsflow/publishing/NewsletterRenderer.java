package com.newsflow.publishing;

import com.newsflow.core.model.Summary;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.List;

/**
 * Builds the newsletter e-mail body from summaries.
 */
@Component
public class NewsletterRenderer {

    static final String TITLE = "AI/ML Weekly Digest";

    public String render(String runId, List<Summary> summaries) {
        var items = new StringBuilder();
        for (Summary summary : summaries) {
            items.append("""
                    <div style="border-left:4px solid #0a66c2;padding:12px 16px;margin-bottom:24px;">
                        <span style="font-size:11px;color:#666;text-transform:uppercase;">%s</span>
                        <h2 style="margin:4px 0;font-size:18px;">%s</h2>
                        <p style="color:#333;line-height:1.6;">%s</p>
                    </div>
                    """.formatted(
                    escape(summary.category() != null ? summary.category() : "AI"),
                    escape(summary.headline()),
                    escape(summary.body())));
        }

        return """
                <!DOCTYPE html>
                <html><head><meta charset="utf-8"></head>
                <body style="font-family:-apple-system,BlinkMacSystemFont,sans-serif;max-width:640px;margin:0 auto;padding:24px;color:#111;">
                <h1 style="border-bottom:2px solid #0a66c2;padding-bottom:12px;">%s</h1>
                <p style="color:#666;font-size:13px;">Run ID: %s</p>
                %s<p style="color:#aaa;font-size:11px;margin-top:32px;">Generated by Newsflow</p>
                </body></html>
                """.formatted(TITLE, escape(runId), items);
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
