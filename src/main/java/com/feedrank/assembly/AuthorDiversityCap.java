package com.feedrank.assembly;

import com.feedrank.model.ScoredPost;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Limits how much of a feed one author can occupy.
 *
 * While fewer than 20 items have been accepted an author may hold at most 3 of them;
 * after that an author may reach 5 in total. Skipped posts are dropped, not deferred.
 */
public final class AuthorDiversityCap {

    static final int HEAD_SIZE = 20;
    static final int HEAD_LIMIT_PER_AUTHOR = 3;
    static final int TOTAL_LIMIT_PER_AUTHOR = 5;

    private AuthorDiversityCap() {
    }

    public static List<ScoredPost> apply(List<ScoredPost> ordered, int limit) {
        if (ordered == null || ordered.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<ScoredPost> accepted = new ArrayList<>(Math.min(limit, ordered.size()));
        Map<String, Integer> perAuthor = new HashMap<>();

        for (ScoredPost scored : ordered) {
            if (accepted.size() >= limit) {
                break;
            }
            String authorId = scored.post().authorId();
            int count = perAuthor.getOrDefault(authorId, 0);
            int maxForAuthor = accepted.size() < HEAD_SIZE ? HEAD_LIMIT_PER_AUTHOR : TOTAL_LIMIT_PER_AUTHOR;
            if (count >= maxForAuthor) {
                continue;
            }
            accepted.add(scored);
            perAuthor.put(authorId, count + 1);
        }
        return accepted;
    }
}
