package com.feedrank.scoring;

import com.feedrank.model.AuthorLookup;
import com.feedrank.model.Post;
import com.feedrank.model.RankingConfig;
import com.feedrank.model.ScoredPost;
import com.feedrank.model.Viewer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes a relevance score and a "why am I seeing this" explanation for an eligible post.
 *
 * The score is the sum of all signal contributions. Reasons are joined in signal order.
 * A signal that fails is logged and skipped, so scoring never throws.
 */
public class FeedScorer {

    private static final Logger log = LoggerFactory.getLogger(FeedScorer.class);

    static final String EXPLANATION_PREFIX = "Because: ";
    static final String DEFAULT_REASON = "recent post";
    static final String REASON_SEPARATOR = " + ";

    private final List<ScoringSignal> signals;

    public FeedScorer(List<ScoringSignal> signals) {
        this.signals = List.copyOf(signals);
    }

    public ScoredPost score(Post post, Viewer viewer, RankingConfig config,
                            List<Post> candidatePool, AuthorLookup authorLookup, Instant now) {
        ScoringContext context = new ScoringContext(post, viewer, config, candidatePool,
            authorLookup != null ? authorLookup : AuthorLookup.none(), now);

        double score = 0;
        List<String> reasons = new ArrayList<>();
        for (ScoringSignal signal : signals) {
            try {
                ScoringSignal.Contribution contribution = signal.contribute(context);
                if (contribution == null) {
                    continue;
                }
                if (Double.isFinite(contribution.points())) {
                    score += contribution.points();
                }
                reasons.addAll(contribution.reasons());
            } catch (RuntimeException ex) {
                log.warn("Scoring signal {} failed for post={}, viewer={}: {}",
                    signal.signalId(), post.id(), viewer.id(), ex.getMessage());
            }
        }

        String explanation = EXPLANATION_PREFIX
            + (reasons.isEmpty() ? DEFAULT_REASON : String.join(REASON_SEPARATOR, reasons));
        return new ScoredPost(post, score, explanation);
    }

    /**
     * The standard signal set, in the order their reasons appear in explanations.
     */
    public static List<ScoringSignal> defaultSignals() {
        return List.of(
            new FollowingSignal(),
            new InterestMatchSignal(),
            new AudienceSimilaritySignal(),
            new TopicPreferenceSignal(),
            new CommunityValidationSignal(),
            new ActiveConversationSignal(),
            new RecencySignal(),
            new ValueScoreSignal(),
            new ModerationSignal()
        );
    }
}
