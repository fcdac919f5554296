package com.feedrank.eligibility;

import com.feedrank.model.Post;
import com.feedrank.model.RankingConfig;
import com.feedrank.model.Viewer;

/**
 * A single deterministic eligibility rule. Rules are pure predicates over their
 * inputs and are evaluated in a fixed order by {@link EligibilityFilter}.
 */
public interface EligibilityRule {

    /** Unique rule identifier, e.g. "self-exclusion". */
    String ruleId();

    /**
     * Evaluate a post for a viewer.
     *
     * @return {@link RuleResult.Continue} to defer to later rules, {@link RuleResult.Admit}
     *     to accept immediately, or {@link RuleResult.Exclude} to reject immediately
     */
    RuleResult evaluate(Post post, Viewer viewer, RankingConfig config, EligibilityOptions options);

    sealed interface RuleResult {
        record Continue() implements RuleResult {}
        record Admit() implements RuleResult {}
        record Exclude(String reasonCode) implements RuleResult {}
    }

    RuleResult CONTINUE = new RuleResult.Continue();
    RuleResult ADMIT = new RuleResult.Admit();
}
