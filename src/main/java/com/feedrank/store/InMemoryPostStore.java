package com.feedrank.store;

import com.feedrank.api.DuplicatePostException;
import com.feedrank.api.PostNotFoundException;
import com.feedrank.model.FactCheckStatus;
import com.feedrank.model.Post;
import com.feedrank.model.ValueScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Keeps posts in insertion order. Posts are immutable, so updates replace the stored instance.
 */
@Component
public class InMemoryPostStore implements PostStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPostStore.class);

    private final ConcurrentHashMap<String, Post> posts = new ConcurrentHashMap<>();
    private final List<String> insertionOrder = new ArrayList<>();

    @Override
    public Post save(Post post) {
        if (post.id() == null || post.id().isBlank()) {
            throw new IllegalArgumentException("post id is required");
        }
        if (post.authorId() == null || post.authorId().isBlank()) {
            throw new IllegalArgumentException("author_id is required");
        }
        if (post.createdAt() == null) {
            throw new IllegalArgumentException("created_at is required");
        }
        if (post.commentCount() < 0) {
            throw new IllegalArgumentException("comment_count must not be negative");
        }
        synchronized (insertionOrder) {
            if (posts.putIfAbsent(post.id(), post) != null) {
                throw new DuplicatePostException(post.id());
            }
            insertionOrder.add(post.id());
        }
        log.info("Stored post {} by author {}", post.id(), post.authorId());
        return post;
    }

    @Override
    public Optional<Post> findById(String postId) {
        return Optional.ofNullable(postId == null ? null : posts.get(postId));
    }

    @Override
    public List<Post> findAll() {
        synchronized (insertionOrder) {
            return insertionOrder.stream()
                .map(posts::get)
                .collect(Collectors.toCollection(ArrayList::new));
        }
    }

    @Override
    public List<Post> findByAuthors(Collection<String> authorIds) {
        Set<String> authors = Set.copyOf(authorIds);
        return findAll().stream()
            .filter(p -> authors.contains(p.authorId()))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Post applyAssessment(String postId, ValueScore valueScore, FactCheckStatus factCheckStatus) {
        Post updated = posts.computeIfPresent(postId,
            (id, existing) -> existing.withAssessment(valueScore, factCheckStatus));
        if (updated == null) {
            throw new PostNotFoundException(postId);
        }
        log.info("Applied assessment to post {}: value={}, factCheck={}",
            postId, valueScore != null ? valueScore.total() : null,
            factCheckStatus != null ? factCheckStatus.getValue() : null);
        return updated;
    }
}
