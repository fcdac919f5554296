package com.feedrank.scoring;

import com.feedrank.matching.TopicMatcher;

import java.util.Optional;

/**
 * Liked topics add 25 points; muted topics subtract 100. Muted posts normally never
 * reach the scorer, except during the relaxed fallback pass.
 */
public class TopicPreferenceSignal implements ScoringSignal {

    static final double LIKED_POINTS = 25;
    static final double MUTED_PENALTY = 100;

    @Override
    public String signalId() {
        return "topic-preference";
    }

    @Override
    public Contribution contribute(ScoringContext context) {
        double points = 0;
        String reason = null;

        Optional<String> liked = TopicMatcher.findMatchingTopic(context.post(), context.config().likedTopics());
        if (liked.isPresent()) {
            points += LIKED_POINTS;
            reason = "topic #" + liked.get() + " you like";
        }
        if (TopicMatcher.matchesAny(context.post(), context.config().mutedTopics())) {
            points -= MUTED_PENALTY;
        }

        return reason != null ? Contribution.of(points, reason) : Contribution.of(points);
    }
}
