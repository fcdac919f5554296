package com.feedrank.assembly;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowSequenceTest {

    @Test
    void defaultWeek_widensThroughOffsetsAndEndsAtThirty() {
        assertEquals(List.of(7, 10, 14, 21, 28, 30), TimeWindowSequence.forBaseDays(7));
    }

    @Test
    void singleDay_includesEveryOffsetAndForcedThirty() {
        assertEquals(List.of(1, 4, 8, 15, 22, 29, 30), TimeWindowSequence.forBaseDays(1));
    }

    @Test
    void largeBase_collapsesToThirty() {
        assertEquals(List.of(30), TimeWindowSequence.forBaseDays(45));
        assertEquals(List.of(25, 28, 30), TimeWindowSequence.forBaseDays(25));
    }

    @Test
    void nonPositiveOrMissingBase_isClamped() {
        assertEquals(1, TimeWindowSequence.clampDays(0));
        assertEquals(1, TimeWindowSequence.clampDays(-4));
        assertEquals(7, TimeWindowSequence.clampDays(null));
        assertEquals(30, TimeWindowSequence.clampDays(31));
    }
}
