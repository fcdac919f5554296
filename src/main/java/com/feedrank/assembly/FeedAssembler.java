package com.feedrank.assembly;

import com.feedrank.eligibility.EligibilityFilter;
import com.feedrank.eligibility.EligibilityOptions;
import com.feedrank.model.AuthorLookup;
import com.feedrank.model.Post;
import com.feedrank.model.RankingConfig;
import com.feedrank.model.ScoredPost;
import com.feedrank.model.Viewer;
import com.feedrank.scoring.FeedScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Builds the personalized "for you" feed from a pre-loaded candidate pool.
 *
 * Tries each window of {@link TimeWindowSequence} in turn, first with muted topics
 * excluded and then with them relaxed, and returns the first pass that yields any
 * eligible post: scored, ordered by {@link ScoreThenRecencyOrdering} and capped by
 * {@link AuthorDiversityCap}. When every pass comes up empty, returns all non-self
 * posts newest first with a zero score.
 *
 * Stateless apart from the clock; safe for concurrent calls. Never throws for
 * empty or partial input.
 */
public class FeedAssembler {

    private static final Logger log = LoggerFactory.getLogger(FeedAssembler.class);

    public static final int DEFAULT_LIMIT = 50;
    static final String FALLBACK_EXPLANATION = "Recent post (fallback)";

    private final EligibilityFilter eligibilityFilter;
    private final FeedScorer scorer;
    private final Clock clock;

    public FeedAssembler(EligibilityFilter eligibilityFilter, FeedScorer scorer, Clock clock) {
        this.eligibilityFilter = Objects.requireNonNull(eligibilityFilter);
        this.scorer = Objects.requireNonNull(scorer);
        this.clock = Objects.requireNonNull(clock);
    }

    public List<ScoredPost> generateFeed(List<Post> candidatePool, Viewer viewer,
                                         RankingConfig config, AuthorLookup authorLookup) {
        return generateFeed(candidatePool, viewer, config, authorLookup, DEFAULT_LIMIT);
    }

    public List<ScoredPost> generateFeed(List<Post> candidatePool, Viewer viewer,
                                         RankingConfig config, AuthorLookup authorLookup, int limit) {
        if (viewer == null || candidatePool == null || candidatePool.isEmpty() || limit <= 0) {
            return List.of();
        }
        RankingConfig effectiveConfig = config != null ? config : RankingConfig.defaults();
        AuthorLookup lookup = authorLookup != null ? authorLookup : AuthorLookup.none();
        Instant now = clock.instant();

        List<Post> others = candidatePool.stream()
            .filter(Objects::nonNull)
            .filter(post -> !Objects.equals(post.authorId(), viewer.id()))
            .toList();

        for (int days : TimeWindowSequence.forBaseDays(effectiveConfig.timeWindowDays())) {
            List<ScoredPost> strict = attempt(others, candidatePool, viewer, effectiveConfig, lookup,
                now, days, EligibilityOptions.STRICT, limit);
            if (!strict.isEmpty()) {
                return strict;
            }

            List<ScoredPost> relaxed = attempt(others, candidatePool, viewer, effectiveConfig, lookup,
                now, days, EligibilityOptions.RELAXED, limit);
            if (!relaxed.isEmpty()) {
                log.debug("Feed for viewer {} built with muted topics relaxed at {}d window", viewer.id(), days);
                return relaxed;
            }
        }

        log.info("No eligible posts for viewer {} in any window; using recency fallback over {} posts",
            viewer.id(), others.size());
        List<ScoredPost> fallback = others.stream()
            .sorted(Comparator.comparing(Post::createdAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .map(post -> new ScoredPost(post, 0.0, FALLBACK_EXPLANATION))
            .toList();
        return AuthorDiversityCap.apply(fallback, limit);
    }

    private List<ScoredPost> attempt(List<Post> others, List<Post> candidatePool, Viewer viewer,
                                     RankingConfig config, AuthorLookup lookup, Instant now,
                                     int days, EligibilityOptions options, int limit) {
        Instant cutoff = now.minus(Duration.ofDays(days));
        List<Post> eligible = others.stream()
            .filter(post -> post.createdAt() != null && post.createdAt().isAfter(cutoff))
            .filter(post -> eligibilityFilter.isEligible(post, viewer, config, options))
            .toList();

        log.debug("Window {}d (ignoreMuted={}) for viewer {}: {} eligible of {}",
            days, options.ignoreMuted(), viewer.id(), eligible.size(), others.size());
        if (eligible.isEmpty()) {
            return List.of();
        }

        List<ScoredPost> scored = eligible.stream()
            .map(post -> scorer.score(post, viewer, config, candidatePool, lookup, now))
            .toList();
        return AuthorDiversityCap.apply(ScoreThenRecencyOrdering.sort(scored), limit);
    }
}
