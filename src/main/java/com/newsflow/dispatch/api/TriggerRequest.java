package com.newsflow.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/runs.
 *
 * @param triggerType MANUAL or SCHEDULED; nullable, defaults to MANUAL
 */
public record TriggerRequest(
    @JsonProperty("trigger_type") String triggerType
) {}
