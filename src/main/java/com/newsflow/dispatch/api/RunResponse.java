package com.newsflow.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON response for run endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
    @JsonProperty("run_id") String runId,
    String status,
    @JsonProperty("current_step") String currentStep,
    @JsonProperty("approval_status") String approvalStatus,
    @JsonProperty("revision_count") int revisionCount,
    @JsonProperty("article_count") int articleCount,
    @JsonProperty("summary_count") int summaryCount,
    @JsonProperty("error_log") List<String> errorLog,
    @JsonProperty("awaiting_node") String awaitingNode,
    Map<String, Object> review,
    String error
) {}
