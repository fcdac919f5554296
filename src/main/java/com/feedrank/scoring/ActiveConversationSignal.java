package com.feedrank.scoring;

import com.feedrank.model.Post;

/**
 * Logarithmic boost for posts with an active comment thread, capped at 20.
 * Prefers the quality-weighted comment score (scaled by 100) when the pipeline has set one.
 */
public class ActiveConversationSignal implements ScoringSignal {

    static final double MAX_POINTS = 20;

    @Override
    public String signalId() {
        return "active-conversation";
    }

    @Override
    public Contribution contribute(ScoringContext context) {
        if (!Boolean.TRUE.equals(context.config().boostActiveConversations())) {
            return Contribution.NONE;
        }

        Post post = context.post();
        Double weighted = post.qualityWeightedCommentScore();
        double metric = weighted != null && weighted != 0 ? weighted * 100 : post.commentCount();
        if (metric <= 0) {
            return Contribution.NONE;
        }

        double boost = Math.min(MAX_POINTS, Math.log10(metric + 1) * 5);
        return boost > 5
            ? Contribution.of(boost, "active conversation")
            : Contribution.of(boost);
    }
}
