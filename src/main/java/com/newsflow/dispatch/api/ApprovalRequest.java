package com.newsflow.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/runs/{runId}/approval.
 *
 * @param action   "approve" or "reject"
 * @param feedback reviewer notes for the next revision; nullable
 */
public record ApprovalRequest(
    String action,
    String feedback
) {}
