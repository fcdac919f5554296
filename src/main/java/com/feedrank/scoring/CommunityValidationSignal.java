package com.feedrank.scoring;

import com.feedrank.model.Post;

import java.util.ArrayList;
import java.util.List;

/**
 * Community validation from bookmarks and reposts, raw and quality-weighted.
 *
 * Quality-weighted scores come from the content-value pipeline and are usually absent
 * on fresh posts. Reasons are only given for boosts large enough to be noticeable.
 */
public class CommunityValidationSignal implements ScoringSignal {

    @Override
    public String signalId() {
        return "community-validation";
    }

    @Override
    public Contribution contribute(ScoringContext context) {
        Post post = context.post();
        double points = 0;
        List<String> reasons = new ArrayList<>();

        if (post.bookmarkCount() != null && post.bookmarkCount() > 0) {
            double boost = Math.min(25, post.bookmarkCount() * 3.0);
            points += boost;
            if (boost > 10) {
                reasons.add("highly bookmarked");
            }
        }

        if (isPositive(post.qualityWeightedBookmarkScore())) {
            double boost = post.qualityWeightedBookmarkScore() * 20;
            points += boost;
            if (boost > 8) {
                reasons.add("quality bookmarked");
            }
        }

        if (post.repostCount() != null && post.repostCount() > 0) {
            double boost = Math.min(20, Math.log10(post.repostCount() + 1) * 8);
            points += boost;
            if (boost > 5) {
                reasons.add("frequently shared");
            }
        }

        if (isPositive(post.qualityWeightedRepostScore())) {
            double boost = post.qualityWeightedRepostScore() * 15;
            points += boost;
            if (boost > 6) {
                reasons.add("quality shared");
            }
        }

        return new Contribution(points, reasons);
    }

    private static boolean isPositive(Double value) {
        return value != null && value > 0;
    }
}
