package com.feedrank.eligibility;

import com.feedrank.model.Post;
import com.feedrank.model.RankingConfig;
import com.feedrank.model.Viewer;

import java.util.Objects;

/**
 * Rule: a viewer never sees their own posts. Not affected by any option.
 */
public class SelfExclusionRule implements EligibilityRule {

    @Override
    public String ruleId() {
        return "self-exclusion";
    }

    @Override
    public RuleResult evaluate(Post post, Viewer viewer, RankingConfig config, EligibilityOptions options) {
        if (Objects.equals(viewer.id(), post.authorId())) {
            return new RuleResult.Exclude("OWN_POST");
        }
        return CONTINUE;
    }
}
