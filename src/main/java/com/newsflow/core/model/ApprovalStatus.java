package com.newsflow.core.model;

/**
 * Reviewer verdict on the generated content.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED
}
