package com.feedrank.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Objects;

/**
 * Personalization settings for one viewer, read as an immutable snapshot per ranking call.
 * Absent values fall back to the product defaults.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RankingConfig(
    @JsonProperty("following_weight") FollowingWeight followingWeight,
    @JsonProperty("boost_active_conversations") Boolean boostActiveConversations,
    @JsonProperty("liked_topics") List<String> likedTopics,
    @JsonProperty("muted_topics") List<String> mutedTopics,
    @JsonProperty("time_window_days") Integer timeWindowDays,
    @JsonProperty("semantic_similarity_threshold") Double semanticSimilarityThreshold
) {

    public static final FollowingWeight DEFAULT_FOLLOWING_WEIGHT = FollowingWeight.MEDIUM;
    public static final int DEFAULT_TIME_WINDOW_DAYS = 7;
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.7;

    public RankingConfig {
        if (followingWeight == null) {
            followingWeight = DEFAULT_FOLLOWING_WEIGHT;
        }
        if (boostActiveConversations == null) {
            boostActiveConversations = Boolean.TRUE;
        }
        likedTopics = likedTopics == null
            ? List.of()
            : likedTopics.stream().filter(Objects::nonNull).toList();
        mutedTopics = mutedTopics == null
            ? List.of()
            : mutedTopics.stream().filter(Objects::nonNull).toList();
        if (timeWindowDays == null) {
            timeWindowDays = DEFAULT_TIME_WINDOW_DAYS;
        }
        if (semanticSimilarityThreshold == null || semanticSimilarityThreshold.isNaN()) {
            semanticSimilarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;
        }
    }

    public static RankingConfig defaults() {
        return new RankingConfig(null, null, null, null, null, null);
    }

    public RankingConfig withLikedTopics(List<String> topics) {
        return new RankingConfig(followingWeight, boostActiveConversations, topics, mutedTopics,
            timeWindowDays, semanticSimilarityThreshold);
    }

    public RankingConfig withMutedTopics(List<String> topics) {
        return new RankingConfig(followingWeight, boostActiveConversations, likedTopics, topics,
            timeWindowDays, semanticSimilarityThreshold);
    }

    public RankingConfig withTimeWindowDays(int days) {
        return new RankingConfig(followingWeight, boostActiveConversations, likedTopics, mutedTopics,
            days, semanticSimilarityThreshold);
    }
}
