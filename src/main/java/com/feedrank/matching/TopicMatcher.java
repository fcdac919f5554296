package com.feedrank.matching;

import com.feedrank.model.Post;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Matches a post's topic and semantic tags against a list of configured topics.
 *
 * Values are compared lower-cased and trimmed. Two values overlap when they are
 * equal or when either contains the other. Blank configured topics never match.
 */
public final class TopicMatcher {

    private TopicMatcher() {
    }

    /**
     * Finds the first configured topic (in configuration order) that overlaps the
     * post's primary topic or any of its semantic tags.
     *
     * @return the configured topic as originally written, or empty
     */
    public static Optional<String> findMatchingTopic(Post post, Collection<String> topics) {
        if (post == null || topics == null || topics.isEmpty()) {
            return Optional.empty();
        }

        String postTopic = normalize(post.topic());
        List<String> tags = post.semanticTopics().stream()
            .map(TopicMatcher::normalize)
            .filter(t -> !t.isEmpty())
            .toList();

        for (String configured : topics) {
            String normalized = normalize(configured);
            if (normalized.isEmpty()) {
                continue;
            }
            if (!postTopic.isEmpty() && overlaps(postTopic, normalized)) {
                return Optional.of(configured);
            }
            for (String tag : tags) {
                if (overlaps(tag, normalized)) {
                    return Optional.of(configured);
                }
            }
        }
        return Optional.empty();
    }

    public static boolean matchesAny(Post post, Collection<String> topics) {
        return findMatchingTopic(post, topics).isPresent();
    }

    /** Case-insensitive containment in either direction. */
    public static boolean fuzzyMatch(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        String left = a.toLowerCase(Locale.ROOT);
        String right = b.toLowerCase(Locale.ROOT);
        return left.contains(right) || right.contains(left);
    }

    static boolean overlaps(String a, String b) {
        return a.equals(b) || a.contains(b) || b.contains(a);
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
