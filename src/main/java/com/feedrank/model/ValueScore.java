package com.feedrank.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Quality estimate attached asynchronously by the content-value pipeline.
 * Both values are nominally in [0,1] but are clamped by consumers.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValueScore(
    @JsonProperty("total") double total,
    @JsonProperty("confidence") Double confidence
) {}
