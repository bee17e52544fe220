package com.newsflow.core.model;

/**
 * What started a pipeline run.
 */
public enum TriggerType {
    SCHEDULED,
    MANUAL
}
