package com.feedrank.eligibility;

import com.feedrank.model.Post;
import com.feedrank.model.RankingConfig;
import com.feedrank.model.Viewer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Decides whether a post may appear in a viewer's feed.
 *
 * Rules run in registration order: the first exclusion or admission wins, and a
 * post that no rule decides is eligible. The filter holds no state and never
 * mutates its inputs.
 */
public class EligibilityFilter {

    private static final Logger log = LoggerFactory.getLogger(EligibilityFilter.class);

    private final List<EligibilityRule> rules;

    public EligibilityFilter(List<EligibilityRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public boolean isEligible(Post post, Viewer viewer, RankingConfig config) {
        return isEligible(post, viewer, config, EligibilityOptions.STRICT);
    }

    public boolean isEligible(Post post, Viewer viewer, RankingConfig config, EligibilityOptions options) {
        EligibilityOptions effective = options != null ? options : EligibilityOptions.STRICT;
        for (EligibilityRule rule : rules) {
            EligibilityRule.RuleResult result = rule.evaluate(post, viewer, config, effective);
            if (result instanceof EligibilityRule.RuleResult.Exclude exclude) {
                log.debug("Post {} excluded for viewer {} by rule {}: {}",
                    post.id(), viewer.id(), rule.ruleId(), exclude.reasonCode());
                return false;
            }
            if (result instanceof EligibilityRule.RuleResult.Admit) {
                return true;
            }
        }
        return true;
    }

    /**
     * The standard rule chain: self exclusion, muted topics, reach mode.
     */
    public static List<EligibilityRule> defaultRules() {
        return List.of(
            new SelfExclusionRule(),
            new MutedTopicRule(),
            new ReachModeRule()
        );
    }
}
