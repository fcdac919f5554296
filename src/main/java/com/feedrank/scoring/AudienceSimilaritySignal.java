package com.feedrank.scoring;

import com.feedrank.matching.VectorSimilarity;
import com.feedrank.model.TunedAudience;

/**
 * Boost for posts whose target audience embedding resembles the viewer's profile
 * embedding, worth up to 35 points. Runs for any reach mode as long as both vectors exist.
 */
public class AudienceSimilaritySignal implements ScoringSignal {

    static final double MAX_POINTS = 35;

    @Override
    public String signalId() {
        return "audience-similarity";
    }

    @Override
    public Contribution contribute(ScoringContext context) {
        TunedAudience audience = context.post().tunedAudience();
        if (audience == null || !audience.hasTargetEmbedding() || !context.viewer().hasProfileEmbedding()) {
            return Contribution.NONE;
        }

        double similarity = VectorSimilarity.cosine(
            audience.targetAudienceEmbedding(), context.viewer().profileEmbedding());
        if (similarity <= 0) {
            return Contribution.NONE;
        }

        double boost = Math.min(MAX_POINTS, Math.round(similarity * MAX_POINTS));
        return Contribution.of(boost,
            "aligns with your profile (" + Math.round(similarity * 100) + "% similarity)");
    }
}
