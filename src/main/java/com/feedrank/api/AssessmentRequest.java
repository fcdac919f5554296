package com.feedrank.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.feedrank.model.FactCheckStatus;
import com.feedrank.model.ValueScore;

/**
 * Result pushed by the content-value pipeline once it has processed a post.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AssessmentRequest(
    @JsonProperty("value_score") ValueScore valueScore,
    @JsonProperty("fact_check_status") FactCheckStatus factCheckStatus
) {}
