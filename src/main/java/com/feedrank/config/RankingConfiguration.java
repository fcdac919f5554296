package com.feedrank.config;

import com.feedrank.assembly.FeedAssembler;
import com.feedrank.eligibility.EligibilityFilter;
import com.feedrank.scoring.FeedScorer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RankingConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Standard eligibility chain:
     * 1. Self exclusion
     * 2. Muted topics (relaxable)
     * 3. Reach mode / tuned audience
     */
    @Bean
    public EligibilityFilter eligibilityFilter() {
        return new EligibilityFilter(EligibilityFilter.defaultRules());
    }

    @Bean
    public FeedScorer feedScorer() {
        return new FeedScorer(FeedScorer.defaultSignals());
    }

    @Bean
    public FeedAssembler feedAssembler(EligibilityFilter eligibilityFilter, FeedScorer feedScorer, Clock clock) {
        return new FeedAssembler(eligibilityFilter, feedScorer, clock);
    }
}
