package com.feedrank.config;

import com.feedrank.model.FollowingWeight;
import com.feedrank.model.RankingConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** Configuration properties for feed assembly and per-viewer ranking defaults. */
@Configuration
@ConfigurationProperties(prefix = "feedrank")
public class FeedProperties {

    private Feed feed = new Feed();
    private Ranking ranking = new Ranking();

    public Feed getFeed() {
        return feed;
    }

    public void setFeed(Feed feed) {
        this.feed = feed;
    }

    public Ranking getRanking() {
        return ranking;
    }

    public void setRanking(Ranking ranking) {
        this.ranking = ranking;
    }

    public static class Feed {
        private int defaultLimit = 50;
        private int maxLimit = 200;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }

        /** Resolves a requested page size: absent means the default, and the max caps it. */
        public int resolveLimit(Integer requested) {
            int limit = requested != null ? requested : defaultLimit;
            return Math.max(0, Math.min(limit, maxLimit));
        }
    }

    /** Ranking config handed to viewers who have not saved their own. */
    public static class Ranking {
        private FollowingWeight followingWeight = RankingConfig.DEFAULT_FOLLOWING_WEIGHT;
        private boolean boostActiveConversations = true;
        private int timeWindowDays = RankingConfig.DEFAULT_TIME_WINDOW_DAYS;
        private double semanticSimilarityThreshold = RankingConfig.DEFAULT_SIMILARITY_THRESHOLD;

        public FollowingWeight getFollowingWeight() {
            return followingWeight;
        }

        public void setFollowingWeight(FollowingWeight followingWeight) {
            this.followingWeight = followingWeight;
        }

        public boolean isBoostActiveConversations() {
            return boostActiveConversations;
        }

        public void setBoostActiveConversations(boolean boostActiveConversations) {
            this.boostActiveConversations = boostActiveConversations;
        }

        public int getTimeWindowDays() {
            return timeWindowDays;
        }

        public void setTimeWindowDays(int timeWindowDays) {
            this.timeWindowDays = timeWindowDays;
        }

        public double getSemanticSimilarityThreshold() {
            return semanticSimilarityThreshold;
        }

        public void setSemanticSimilarityThreshold(double semanticSimilarityThreshold) {
            this.semanticSimilarityThreshold = semanticSimilarityThreshold;
        }

        public RankingConfig toConfig() {
            return new RankingConfig(followingWeight, boostActiveConversations, List.of(), List.of(),
                timeWindowDays, semanticSimilarityThreshold);
        }
    }
}
