package com.feedrank.model;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves an author id to display metadata. A miss is not an error.
 */
@FunctionalInterface
public interface AuthorLookup {

    Optional<AuthorProfile> findAuthor(String authorId);

    static AuthorLookup none() {
        return authorId -> Optional.empty();
    }

    static AuthorLookup of(Collection<AuthorProfile> authors) {
        Map<String, AuthorProfile> byId = authors.stream()
            .filter(a -> a != null && a.id() != null)
            .collect(Collectors.toMap(AuthorProfile::id, Function.identity(), (a, b) -> b));
        return authorId -> Optional.ofNullable(authorId == null ? null : byId.get(authorId));
    }
}
