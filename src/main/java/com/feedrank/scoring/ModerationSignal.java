package com.feedrank.scoring;

import com.feedrank.model.FactCheckStatus;
import com.feedrank.model.Post;

import java.util.ArrayList;
import java.util.List;

/**
 * Penalties for moderation outcomes that leaked past the visibility filter:
 * -50 for blocked, -20 for needs review, and -15 when engagement prediction
 * validation flagged the post for possible gaming.
 */
public class ModerationSignal implements ScoringSignal {

    static final double BLOCKED_PENALTY = 50;
    static final double NEEDS_REVIEW_PENALTY = 20;
    static final double PREDICTION_MISMATCH_PENALTY = 15;

    @Override
    public String signalId() {
        return "moderation";
    }

    @Override
    public Contribution contribute(ScoringContext context) {
        Post post = context.post();
        double points = 0;
        List<String> reasons = new ArrayList<>();

        if (post.factCheckStatus() == FactCheckStatus.BLOCKED) {
            points -= BLOCKED_PENALTY;
            reasons.add("blocked by fact-check");
        } else if (post.factCheckStatus() == FactCheckStatus.NEEDS_REVIEW) {
            points -= NEEDS_REVIEW_PENALTY;
            reasons.add("fact-check needs review");
        }

        if (post.predictionValidation() != null && post.predictionValidation().flaggedForReview()) {
            points -= PREDICTION_MISMATCH_PENALTY;
            reasons.add("prediction mismatch (possible gaming)");
        }
        return new Contribution(points, reasons);
    }
}
