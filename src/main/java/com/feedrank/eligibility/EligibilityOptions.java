package com.feedrank.eligibility;

/**
 * Per-pass switches for the eligibility filter.
 *
 * @param ignoreMuted skip the muted-topic exclusion; used only by the relaxed fallback pass
 */
public record EligibilityOptions(boolean ignoreMuted) {

    public static final EligibilityOptions STRICT = new EligibilityOptions(false);
    public static final EligibilityOptions RELAXED = new EligibilityOptions(true);
}
