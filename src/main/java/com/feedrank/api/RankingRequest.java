package com.feedrank.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.feedrank.model.AuthorProfile;
import com.feedrank.model.Post;
import com.feedrank.model.RankingConfig;
import com.feedrank.model.Viewer;

import java.util.List;

/**
 * Stateless ranking request: the caller supplies every input.
 *
 * <pre>
 * {
 *   "candidates": [ { "id": "p1", "author_id": "a1", "created_at": "...", ... } ],
 *   "viewer": { "id": "v1", "following": ["a1"], "interests": ["jazz"] },
 *   "config": { "following_weight": "medium", "muted_topics": ["politics"] },  // optional
 *   "authors": [ { "id": "a1", "handle": "alice" } ],                           // optional
 *   "limit": 20                                                                  // optional
 * }
 * </pre>
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RankingRequest(
    @JsonProperty("candidates") List<Post> candidates,
    @JsonProperty("viewer") Viewer viewer,
    @JsonProperty("config") RankingConfig config,
    @JsonProperty("authors") List<AuthorProfile> authors,
    @JsonProperty("limit") Integer limit
) {}
