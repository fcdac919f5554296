package com.feedrank.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.feedrank.model.ScoredPost;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeedResponse(
    @JsonProperty("viewer_id") String viewerId,
    @JsonProperty("feed_type") String feedType,
    @JsonProperty("count") int count,
    @JsonProperty("items") List<ScoredPost> items
) {

    public static FeedResponse of(String viewerId, String feedType, List<ScoredPost> items) {
        return new FeedResponse(viewerId, feedType, items.size(), items);
    }
}
