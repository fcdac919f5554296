package com.feedrank.store;

import com.feedrank.model.FactCheckStatus;
import com.feedrank.model.Post;
import com.feedrank.model.ValueScore;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PostStore {
    Post save(Post post);

    Optional<Post> findById(String postId);

    List<Post> findAll();

    List<Post> findByAuthors(Collection<String> authorIds);

    Post applyAssessment(String postId, ValueScore valueScore, FactCheckStatus factCheckStatus);
}
