package com.feedrank.store;

import com.feedrank.config.FeedProperties;
import com.feedrank.model.RankingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-viewer ranking config snapshots. Viewers without a saved config get the
 * configured defaults. Writes replace the whole snapshot.
 */
@Component
public class RankingConfigStore {

    private static final Logger log = LoggerFactory.getLogger(RankingConfigStore.class);

    private final ConcurrentHashMap<String, RankingConfig> configs = new ConcurrentHashMap<>();
    private final FeedProperties properties;

    public RankingConfigStore(FeedProperties properties) {
        this.properties = properties;
    }

    public RankingConfig get(String viewerId) {
        RankingConfig stored = configs.get(viewerId);
        return stored != null ? stored : properties.getRanking().toConfig();
    }

    public RankingConfig put(String viewerId, RankingConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("ranking config is required");
        }
        validate(config);
        configs.put(viewerId, config);
        log.info("Updated ranking config for viewer {}: weight={}, window={}d, muted={}, liked={}",
            viewerId, config.followingWeight().getValue(), config.timeWindowDays(),
            config.mutedTopics().size(), config.likedTopics().size());
        return config;
    }

    private void validate(RankingConfig config) {
        if (config.timeWindowDays() < 1) {
            throw new IllegalArgumentException("time_window_days must be at least 1");
        }
        double threshold = config.semanticSimilarityThreshold();
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("semantic_similarity_threshold must be within [0, 1]");
        }
    }
}
