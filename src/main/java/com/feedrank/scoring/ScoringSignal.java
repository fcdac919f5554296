package com.feedrank.scoring;

import java.util.List;

/**
 * One additive term of the relevance score. Signals must be pure: no side effects,
 * no mutation of the context. A signal whose input is missing contributes nothing.
 */
public interface ScoringSignal {

    /** Unique signal identifier, e.g. "following". */
    String signalId();

    Contribution contribute(ScoringContext context);

    /**
     * Points added by a signal plus the viewer-facing reasons it produced, in order.
     */
    record Contribution(double points, List<String> reasons) {

        public static final Contribution NONE = new Contribution(0.0, List.of());

        public Contribution {
            reasons = reasons == null ? List.of() : List.copyOf(reasons);
        }

        public static Contribution of(double points) {
            return new Contribution(points, List.of());
        }

        public static Contribution of(double points, String reason) {
            return new Contribution(points, List.of(reason));
        }
    }
}
