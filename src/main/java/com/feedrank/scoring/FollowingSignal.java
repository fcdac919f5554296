package com.feedrank.scoring;

import com.feedrank.model.AuthorLookup;
import com.feedrank.model.AuthorProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Bonus for posts by authors the viewer follows, sized by the configured following weight.
 * The handle is only mentioned when the author lookup resolves it; a failing lookup
 * costs the handle, never the bonus.
 */
public class FollowingSignal implements ScoringSignal {

    private static final Logger log = LoggerFactory.getLogger(FollowingSignal.class);

    @Override
    public String signalId() {
        return "following";
    }

    @Override
    public Contribution contribute(ScoringContext context) {
        if (!context.viewer().follows(context.post().authorId())) {
            return Contribution.NONE;
        }

        int bonus = context.config().followingWeight().bonus();
        if (bonus <= 0) {
            return Contribution.NONE;
        }

        return resolveAuthor(context.authorLookup(), context.post().authorId())
            .filter(a -> a.handle() != null && !a.handle().isBlank())
            .map(a -> Contribution.of(bonus, "you follow @" + a.handle()))
            .orElseGet(() -> Contribution.of(bonus));
    }

    private static Optional<AuthorProfile> resolveAuthor(AuthorLookup lookup, String authorId) {
        if (lookup == null) {
            return Optional.empty();
        }
        try {
            Optional<AuthorProfile> author = lookup.findAuthor(authorId);
            return author != null ? author : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Author lookup failed for {}, omitting handle: {}", authorId, e.getMessage());
            return Optional.empty();
        }
    }
}
