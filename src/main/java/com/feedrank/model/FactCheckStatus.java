package com.feedrank.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Moderation outcome attached to a post by the content-value pipeline.
 */
public enum FactCheckStatus {
    CLEAN("clean"),
    NEEDS_REVIEW("needs_review"),
    BLOCKED("blocked");

    private final String value;

    FactCheckStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FactCheckStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown fact-check status: " + raw));
    }
}
