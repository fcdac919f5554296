package com.feedrank.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * How strongly posts from followed authors are favoured.
 * Each level maps to a fixed score bonus.
 */
public enum FollowingWeight {
    NONE("none", 0),
    LIGHT("light", 10),
    MEDIUM("medium", 30),
    HEAVY("heavy", 50);

    private final String value;
    private final int bonus;

    FollowingWeight(String value, int bonus) {
        this.value = value;
        this.bonus = bonus;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Score added when the viewer follows the post's author. */
    public int bonus() {
        return bonus;
    }

    @JsonCreator
    public static FollowingWeight fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown following weight: " + raw));
    }
}
