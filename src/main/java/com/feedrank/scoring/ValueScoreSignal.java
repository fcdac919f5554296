package com.feedrank.scoring;

import com.feedrank.model.ValueScore;

import java.util.ArrayList;
import java.util.List;

/**
 * Quality-aware boost from the content-value pipeline's score.
 *
 * Adds {@code value * 40 * max(0.5, confidence)}. Values of 0.7 and above are called
 * out as high value; values below 0.35 are additionally penalised by
 * {@code (0.35 - value) * 30}. A missing value score contributes nothing.
 */
public class ValueScoreSignal implements ScoringSignal {

    static final double WEIGHT = 40;
    static final double MIN_CONFIDENCE_FACTOR = 0.5;
    static final double HIGH_VALUE_THRESHOLD = 0.7;
    static final double LOW_VALUE_THRESHOLD = 0.35;
    static final double LOW_VALUE_PENALTY_WEIGHT = 30;

    @Override
    public String signalId() {
        return "value-score";
    }

    @Override
    public Contribution contribute(ScoringContext context) {
        ValueScore valueScore = context.post().valueScore();
        if (valueScore == null) {
            return Contribution.NONE;
        }

        double value = clamp01(valueScore.total());
        double confidence = clamp01(valueScore.confidence() != null ? valueScore.confidence() : 0);
        double points = value * WEIGHT * Math.max(MIN_CONFIDENCE_FACTOR, confidence);
        List<String> reasons = new ArrayList<>();

        if (value >= HIGH_VALUE_THRESHOLD) {
            reasons.add("high value content");
        } else if (value < LOW_VALUE_THRESHOLD) {
            points -= (LOW_VALUE_THRESHOLD - value) * LOW_VALUE_PENALTY_WEIGHT;
            reasons.add("low value content");
        }
        return new Contribution(points, reasons);
    }

    static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(1, value));
    }
}
