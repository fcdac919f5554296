package com.feedrank.eligibility;

import com.feedrank.matching.TopicMatcher;
import com.feedrank.model.Post;
import com.feedrank.model.RankingConfig;
import com.feedrank.model.Viewer;

/**
 * Rule: excludes posts whose topic or semantic tags overlap a muted topic,
 * unless the pass runs with {@link EligibilityOptions#ignoreMuted()}.
 */
public class MutedTopicRule implements EligibilityRule {

    @Override
    public String ruleId() {
        return "muted-topic";
    }

    @Override
    public RuleResult evaluate(Post post, Viewer viewer, RankingConfig config, EligibilityOptions options) {
        if (options.ignoreMuted()) {
            return CONTINUE;
        }
        if (TopicMatcher.matchesAny(post, config.mutedTopics())) {
            return new RuleResult.Exclude("MUTED_TOPIC");
        }
        return CONTINUE;
    }
}
