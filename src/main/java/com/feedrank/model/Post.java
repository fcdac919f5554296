package com.feedrank.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A candidate post as supplied by the persistence layer.
 *
 * Optional fields are {@code null} when absent. The value score, fact-check status
 * and quality-weighted engagement scores are attached later by the content-value
 * pipeline and are frequently missing on fresh posts.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Post(
    @JsonProperty("id") String id,
    @JsonProperty("author_id") String authorId,
    @JsonProperty("text") String text,
    @JsonProperty("topic") String topic,
    @JsonProperty("semantic_topics") List<String> semanticTopics,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("comment_count") int commentCount,
    @JsonProperty("bookmark_count") Integer bookmarkCount,
    @JsonProperty("repost_count") Integer repostCount,
    @JsonProperty("reach_mode") ReachMode reachMode,
    @JsonProperty("tuned_audience") TunedAudience tunedAudience,
    @JsonProperty("value_score") ValueScore valueScore,
    @JsonProperty("fact_check_status") FactCheckStatus factCheckStatus,
    @JsonProperty("quality_weighted_bookmark_score") Double qualityWeightedBookmarkScore,
    @JsonProperty("quality_weighted_repost_score") Double qualityWeightedRepostScore,
    @JsonProperty("quality_weighted_comment_score") Double qualityWeightedCommentScore,
    @JsonProperty("prediction_validation") PredictionValidation predictionValidation
) {

    public Post {
        // tags are a set; first-seen order keeps the "first matching tag" reason stable
        semanticTopics = semanticTopics == null
            ? List.of()
            : semanticTopics.stream().filter(Objects::nonNull).distinct().toList();
        if (reachMode == null) {
            reachMode = ReachMode.FOR_ALL;
        }
    }

    /** Copy of this post carrying the content-value pipeline's latest assessment. */
    public Post withAssessment(ValueScore newValueScore, FactCheckStatus newFactCheckStatus) {
        return toBuilder()
            .valueScore(newValueScore)
            .factCheckStatus(newFactCheckStatus)
            .build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(id, authorId, createdAt);
        builder.text = text;
        builder.topic = topic;
        builder.semanticTopics = semanticTopics;
        builder.commentCount = commentCount;
        builder.bookmarkCount = bookmarkCount;
        builder.repostCount = repostCount;
        builder.reachMode = reachMode;
        builder.tunedAudience = tunedAudience;
        builder.valueScore = valueScore;
        builder.factCheckStatus = factCheckStatus;
        builder.qualityWeightedBookmarkScore = qualityWeightedBookmarkScore;
        builder.qualityWeightedRepostScore = qualityWeightedRepostScore;
        builder.qualityWeightedCommentScore = qualityWeightedCommentScore;
        builder.predictionValidation = predictionValidation;
        return builder;
    }

    public static Builder builder(String id, String authorId, Instant createdAt) {
        return new Builder(id, authorId, createdAt);
    }

    public static final class Builder {
        private final String id;
        private final String authorId;
        private final Instant createdAt;
        private String text;
        private String topic;
        private List<String> semanticTopics = List.of();
        private int commentCount;
        private Integer bookmarkCount;
        private Integer repostCount;
        private ReachMode reachMode = ReachMode.FOR_ALL;
        private TunedAudience tunedAudience;
        private ValueScore valueScore;
        private FactCheckStatus factCheckStatus;
        private Double qualityWeightedBookmarkScore;
        private Double qualityWeightedRepostScore;
        private Double qualityWeightedCommentScore;
        private PredictionValidation predictionValidation;

        private Builder(String id, String authorId, Instant createdAt) {
            this.id = id;
            this.authorId = authorId;
            this.createdAt = createdAt;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder topic(String topic) {
            this.topic = topic;
            return this;
        }

        public Builder semanticTopics(List<String> semanticTopics) {
            this.semanticTopics = semanticTopics;
            return this;
        }

        public Builder commentCount(int commentCount) {
            this.commentCount = commentCount;
            return this;
        }

        public Builder bookmarkCount(Integer bookmarkCount) {
            this.bookmarkCount = bookmarkCount;
            return this;
        }

        public Builder repostCount(Integer repostCount) {
            this.repostCount = repostCount;
            return this;
        }

        public Builder reachMode(ReachMode reachMode) {
            this.reachMode = reachMode;
            return this;
        }

        public Builder tunedAudience(TunedAudience tunedAudience) {
            this.tunedAudience = tunedAudience;
            return this;
        }

        public Builder valueScore(ValueScore valueScore) {
            this.valueScore = valueScore;
            return this;
        }

        public Builder factCheckStatus(FactCheckStatus factCheckStatus) {
            this.factCheckStatus = factCheckStatus;
            return this;
        }

        public Builder qualityWeightedBookmarkScore(Double score) {
            this.qualityWeightedBookmarkScore = score;
            return this;
        }

        public Builder qualityWeightedRepostScore(Double score) {
            this.qualityWeightedRepostScore = score;
            return this;
        }

        public Builder qualityWeightedCommentScore(Double score) {
            this.qualityWeightedCommentScore = score;
            return this;
        }

        public Builder predictionValidation(PredictionValidation predictionValidation) {
            this.predictionValidation = predictionValidation;
            return this;
        }

        public Post build() {
            return new Post(id, authorId, text, topic, semanticTopics, createdAt, commentCount,
                bookmarkCount, repostCount, reachMode, tunedAudience, valueScore, factCheckStatus,
                qualityWeightedBookmarkScore, qualityWeightedRepostScore, qualityWeightedCommentScore,
                predictionValidation);
        }
    }
}
