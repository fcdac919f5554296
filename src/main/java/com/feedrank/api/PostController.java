package com.feedrank.api;

import com.feedrank.model.Post;
import com.feedrank.store.PostStore;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Candidate post intake and the content-value pipeline's write-back.
 *
 * POST /v1/posts
 * GET  /v1/posts/{postId}
 * PUT  /v1/posts/{postId}/assessment
 */
@RestController
@RequestMapping("/v1/posts")
public class PostController {

    private final PostStore postStore;

    public PostController(PostStore postStore) {
        this.postStore = postStore;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> create(@RequestBody Post post) {
        Post saved = postStore.save(post);
        return Map.of(
            "status", "accepted",
            "post_id", saved.id()
        );
    }

    @GetMapping("/{postId}")
    public Post get(@PathVariable String postId) {
        return postStore.findById(postId)
            .orElseThrow(() -> new PostNotFoundException(postId));
    }

    @PutMapping("/{postId}/assessment")
    public Post assess(@PathVariable String postId, @RequestBody AssessmentRequest request) {
        return postStore.applyAssessment(postId, request.valueScore(), request.factCheckStatus());
    }
}
