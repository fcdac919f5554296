package com.feedrank.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of comparing a post's predicted engagement with what it actually received.
 * A flagged post is suspected of engagement gaming.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PredictionValidation(
    @JsonProperty("flagged_for_review") boolean flaggedForReview,
    @JsonProperty("overall_error") Double overallError
) {}
