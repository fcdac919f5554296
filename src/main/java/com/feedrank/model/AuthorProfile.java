package com.feedrank.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Minimal author metadata used to build rationale text.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuthorProfile(
    @JsonProperty("id") String id,
    @JsonProperty("handle") String handle
) {}
