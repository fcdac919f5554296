package com.feedrank.scoring;

import java.time.Duration;

/**
 * Linear recency decay: 15 points for a brand-new post, losing half a point per hour,
 * reaching zero at 30 hours. Never produces a reason.
 */
public class RecencySignal implements ScoringSignal {

    static final double MAX_POINTS = 15;
    static final double DECAY_PER_HOUR = 0.5;

    private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    @Override
    public String signalId() {
        return "recency";
    }

    @Override
    public Contribution contribute(ScoringContext context) {
        if (context.post().createdAt() == null || context.now() == null) {
            return Contribution.NONE;
        }
        double hoursAgo = Duration.between(context.post().createdAt(), context.now()).toMillis() / MILLIS_PER_HOUR;
        return Contribution.of(Math.max(0, MAX_POINTS - hoursAgo * DECAY_PER_HOUR));
    }
}
