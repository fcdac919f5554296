package com.feedrank.eligibility;

import com.feedrank.matching.VectorSimilarity;
import com.feedrank.model.Post;
import com.feedrank.model.RankingConfig;
import com.feedrank.model.ReachMode;
import com.feedrank.model.TunedAudience;
import com.feedrank.model.Viewer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule: applies the post's reach settings.
 *
 * For-all posts are admitted. Tuned posts are admitted when the follow relationship
 * matches one of the allowed audiences, or when the viewer's profile embedding is
 * similar enough to the target audience embedding. A tuned post without audience
 * settings fails closed.
 */
public class ReachModeRule implements EligibilityRule {

    private static final Logger log = LoggerFactory.getLogger(ReachModeRule.class);

    @Override
    public String ruleId() {
        return "reach-mode";
    }

    @Override
    public RuleResult evaluate(Post post, Viewer viewer, RankingConfig config, EligibilityOptions options) {
        if (post.reachMode() != ReachMode.TUNED) {
            return ADMIT;
        }

        TunedAudience audience = post.tunedAudience();
        if (audience == null) {
            log.warn("Post {} uses tuned reach without audience settings", post.id());
            return new RuleResult.Exclude("TUNED_AUDIENCE_MISSING");
        }

        boolean following = viewer.follows(post.authorId());
        if (audience.allowFollowers() && following) {
            return ADMIT;
        }
        if (audience.allowNonFollowers() && !following) {
            return ADMIT;
        }

        boolean embeddingsPresent = audience.hasTargetEmbedding() && viewer.hasProfileEmbedding();
        if (embeddingsPresent) {
            double similarity = VectorSimilarity.cosine(
                audience.targetAudienceEmbedding(), viewer.profileEmbedding());
            if (similarity >= config.semanticSimilarityThreshold()) {
                return ADMIT;
            }
            log.warn("Post {} tuned audience profile summary mismatch for viewer {} (similarity={})",
                post.id(), viewer.id(), String.format("%.3f", similarity));
            return new RuleResult.Exclude("AUDIENCE_EMBEDDING_MISMATCH");
        }

        log.warn("Post {} tuned audience explicitly hides viewer {}", post.id(), viewer.id());
        return new RuleResult.Exclude("AUDIENCE_EXCLUDED");
    }
}
