package com.feedrank.scoring;

import com.feedrank.matching.TopicMatcher;

import java.util.List;

/**
 * Rewards semantic tags that fuzzily match the viewer's interests:
 * 30 for any match plus 5 per matching tag, the per-tag part capped at 25.
 */
public class InterestMatchSignal implements ScoringSignal {

    static final double BASE_POINTS = 30;
    static final double POINTS_PER_MATCH = 5;
    static final double MAX_MATCH_POINTS = 25;

    @Override
    public String signalId() {
        return "interest-match";
    }

    @Override
    public Contribution contribute(ScoringContext context) {
        List<String> interests = context.viewer().interests();
        List<String> tags = context.post().semanticTopics();
        if (interests.isEmpty() || tags.isEmpty()) {
            return Contribution.NONE;
        }

        List<String> matches = tags.stream()
            .filter(tag -> interests.stream().anyMatch(interest -> TopicMatcher.fuzzyMatch(interest, tag)))
            .toList();
        if (matches.isEmpty()) {
            return Contribution.NONE;
        }

        double points = BASE_POINTS + Math.min(matches.size() * POINTS_PER_MATCH, MAX_MATCH_POINTS);
        return Contribution.of(points, "matches your interest \"" + matches.get(0) + "\"");
    }
}
