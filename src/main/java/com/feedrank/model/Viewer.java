package com.feedrank.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The person the feed is built for. Only {@code id} is required; missing
 * collections are treated as empty.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Viewer(
    @JsonProperty("id") String id,
    @JsonProperty("handle") String handle,
    @JsonProperty("following") Set<String> following,
    @JsonProperty("interests") List<String> interests,
    @JsonProperty("profile_embedding") double[] profileEmbedding
) {

    public Viewer {
        following = following == null
            ? Set.of()
            : following.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
        interests = interests == null
            ? List.of()
            : interests.stream().filter(Objects::nonNull).toList();
    }

    public static Viewer of(String id) {
        return new Viewer(id, null, Set.of(), List.of(), null);
    }

    public boolean follows(String authorId) {
        return authorId != null && following.contains(authorId);
    }

    public boolean hasProfileEmbedding() {
        return profileEmbedding != null && profileEmbedding.length > 0;
    }
}
