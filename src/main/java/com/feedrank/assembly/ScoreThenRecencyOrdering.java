package com.feedrank.assembly;

import com.feedrank.model.ScoredPost;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders scored posts by score, treating near-equal scores as ties broken by recency.
 *
 * Two scores tie when they differ by less than {@code max(2, 5% of the larger magnitude)};
 * tied posts are ordered newest first. This relation is not transitive, so
 * {@link List#sort} may reject it. {@link #sort(List)} uses a merge sort that
 * applies the comparator pairwise without contract checks.
 */
public final class ScoreThenRecencyOrdering implements Comparator<ScoredPost> {

    public static final ScoreThenRecencyOrdering INSTANCE = new ScoreThenRecencyOrdering();

    static final double MIN_TIE_THRESHOLD = 2.0;
    static final double TIE_FRACTION = 0.05;

    private ScoreThenRecencyOrdering() {
    }

    @Override
    public int compare(ScoredPost a, ScoredPost b) {
        double diff = Math.abs(a.score() - b.score());
        double maxScore = Math.max(Math.abs(a.score()), Math.abs(b.score()));
        double threshold = Math.max(MIN_TIE_THRESHOLD, maxScore * TIE_FRACTION);

        if (diff < threshold) {
            return createdAtOrMin(b).compareTo(createdAtOrMin(a));
        }
        return Double.compare(b.score(), a.score());
    }

    /**
     * Stable sort into a new list; the input is left untouched.
     */
    public static List<ScoredPost> sort(List<ScoredPost> scored) {
        List<ScoredPost> result = new ArrayList<>(scored);
        if (result.size() < 2) {
            return result;
        }
        ScoredPost[] buffer = new ScoredPost[result.size()];
        mergeSort(result, buffer, 0, result.size());
        return result;
    }

    private static void mergeSort(List<ScoredPost> items, ScoredPost[] buffer, int from, int to) {
        if (to - from < 2) {
            return;
        }
        int mid = (from + to) >>> 1;
        mergeSort(items, buffer, from, mid);
        mergeSort(items, buffer, mid, to);

        int left = from;
        int right = mid;
        int out = from;
        while (left < mid && right < to) {
            if (INSTANCE.compare(items.get(right), items.get(left)) < 0) {
                buffer[out++] = items.get(right++);
            } else {
                buffer[out++] = items.get(left++);
            }
        }
        while (left < mid) {
            buffer[out++] = items.get(left++);
        }
        while (right < to) {
            buffer[out++] = items.get(right++);
        }
        for (int i = from; i < to; i++) {
            items.set(i, buffer[i]);
        }
    }

    private static Instant createdAtOrMin(ScoredPost scored) {
        Instant createdAt = scored.post().createdAt();
        return createdAt != null ? createdAt : Instant.MIN;
    }
}
