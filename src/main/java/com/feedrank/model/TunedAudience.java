package com.feedrank.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Targeting descriptor for posts with {@link ReachMode#TUNED} reach.
 * The embedding is produced by an external generator and may be absent.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TunedAudience(
    @JsonProperty("allow_followers") boolean allowFollowers,
    @JsonProperty("allow_non_followers") boolean allowNonFollowers,
    @JsonProperty("target_audience_embedding") double[] targetAudienceEmbedding,
    @JsonProperty("target_audience_description") String targetAudienceDescription
) {

    public boolean hasTargetEmbedding() {
        return targetAudienceEmbedding != null && targetAudienceEmbedding.length > 0;
    }
}
