package com.feedrank.assembly;

import com.feedrank.model.RankingConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * The widening sequence of recency windows, in days, tried when building a feed.
 *
 * Starts at the configured window and adds fixed offsets, each clamped to 30 days,
 * with duplicates removed and a final 30-day attempt appended if not already present.
 */
public final class TimeWindowSequence {

    public static final int MIN_WINDOW_DAYS = 1;
    public static final int MAX_WINDOW_DAYS = 30;

    private static final int[] OFFSETS = {0, 3, 7, 14, 21, 28};

    private TimeWindowSequence() {
    }

    public static int clampDays(Integer days) {
        if (days == null) {
            return RankingConfig.DEFAULT_TIME_WINDOW_DAYS;
        }
        return Math.min(Math.max(MIN_WINDOW_DAYS, days), MAX_WINDOW_DAYS);
    }

    public static List<Integer> forBaseDays(Integer configuredDays) {
        int base = clampDays(configuredDays);
        List<Integer> windows = new ArrayList<>();
        for (int offset : OFFSETS) {
            addDistinct(windows, clampDays(base + offset));
        }
        addDistinct(windows, MAX_WINDOW_DAYS);
        return List.copyOf(windows);
    }

    private static void addDistinct(List<Integer> windows, int days) {
        if (!windows.contains(days)) {
            windows.add(days);
        }
    }
}
