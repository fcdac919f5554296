package com.feedrank.store;

import com.feedrank.model.AuthorLookup;
import com.feedrank.model.AuthorProfile;
import com.feedrank.model.Viewer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Viewer profiles by id. Doubles as the author lookup used for rationale text.
 */
@Component
public class ViewerDirectory implements AuthorLookup {

    private static final Logger log = LoggerFactory.getLogger(ViewerDirectory.class);

    private final ConcurrentHashMap<String, Viewer> viewers = new ConcurrentHashMap<>();

    public Viewer upsert(Viewer viewer) {
        if (viewer.id() == null || viewer.id().isBlank()) {
            throw new IllegalArgumentException("viewer id is required");
        }
        viewers.put(viewer.id(), viewer);
        log.info("Stored viewer {} following {} authors", viewer.id(), viewer.following().size());
        return viewer;
    }

    public Optional<Viewer> findById(String viewerId) {
        return Optional.ofNullable(viewerId == null ? null : viewers.get(viewerId));
    }

    @Override
    public Optional<AuthorProfile> findAuthor(String authorId) {
        return findById(authorId).map(v -> new AuthorProfile(v.id(), v.handle()));
    }
}
