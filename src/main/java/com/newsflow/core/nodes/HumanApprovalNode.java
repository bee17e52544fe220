package com.newsflow.core.nodes;

import com.newsflow.core.interrupt.Interrupts;
import com.newsflow.core.interrupt.ResumeDecision;
import com.newsflow.core.model.ApprovalStatus;
import com.newsflow.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pauses the run until a reviewer approves or rejects the generated content.
 *
 * <p>Everything before {@link Interrupts#suspend} is recomputed when the run is
 * resumed, so it only reads state.
 */
@Component
public class HumanApprovalNode {

    private static final Logger log = LoggerFactory.getLogger(HumanApprovalNode.class);

    static final int PREVIEW_LENGTH = 500;
    static final String MESSAGE = "Please review the content and approve or reject with feedback.";

    public Map<String, Object> apply(PipelineState state) {
        log.info("Awaiting approval for run {} ({} chars post, {} images)",
                state.runId(), state.linkedinDraft().length(), state.imagePaths().size());

        ResumeDecision decision = Interrupts.suspend(preview(state));

        log.info("Approval decision for run {}: {} (feedback: {})",
                state.runId(), decision.action(), decision.feedback().isEmpty() ? "none" : "yes");
        if (decision.approved()) {
            return Map.of(
                    "approvalStatus", ApprovalStatus.APPROVED.name(),
                    "currentStep", "approved");
        }
        return Map.of(
                "approvalStatus", ApprovalStatus.REJECTED.name(),
                "feedback", decision.feedback(),
                "currentStep", "revision_requested");
    }

    static Map<String, Object> preview(PipelineState state) {
        String html = state.newsletterHtml();
        var payload = new LinkedHashMap<String, Object>();
        payload.put("linkedin_draft", state.linkedinDraft());
        payload.put("newsletter_preview", html.length() > PREVIEW_LENGTH ? html.substring(0, PREVIEW_LENGTH) : html);
        payload.put("image_count", state.imagePaths().size());
        payload.put("summary_count", state.summaries().size());
        payload.put("message", MESSAGE);
        return payload;
    }

    /** Route taken after the approval step. */
    public static String route(PipelineState state) {
        return state.approvalStatus() == ApprovalStatus.APPROVED ? "publish" : "revise";
    }
}
