package com.feedrank.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A ranked feed entry. The explanation is shown verbatim to the viewer.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScoredPost(
    @JsonProperty("post") Post post,
    @JsonProperty("score") double score,
    @JsonProperty("explanation") String explanation
) {}
