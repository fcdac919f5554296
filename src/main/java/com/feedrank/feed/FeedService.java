package com.feedrank.feed;

import com.feedrank.api.ViewerNotFoundException;
import com.feedrank.assembly.FeedAssembler;
import com.feedrank.model.AuthorLookup;
import com.feedrank.model.AuthorProfile;
import com.feedrank.model.Post;
import com.feedrank.model.RankingConfig;
import com.feedrank.model.ScoredPost;
import com.feedrank.model.Viewer;
import com.feedrank.store.PostStore;
import com.feedrank.store.RankingConfigStore;
import com.feedrank.store.ViewerDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Entry point for feed reads. Loads the viewer, their ranking config and the candidate
 * posts from the stores and hands them to the {@link FeedAssembler}. Nothing is cached;
 * every call ranks from fresh snapshots.
 */
@Service
public class FeedService {

    private static final Logger log = LoggerFactory.getLogger(FeedService.class);

    private final FeedAssembler assembler;
    private final PostStore postStore;
    private final ViewerDirectory viewerDirectory;
    private final RankingConfigStore configStore;

    public FeedService(FeedAssembler assembler,
                       PostStore postStore,
                       ViewerDirectory viewerDirectory,
                       RankingConfigStore configStore) {
        this.assembler = assembler;
        this.postStore = postStore;
        this.viewerDirectory = viewerDirectory;
        this.configStore = configStore;
    }

    /** Personalized, ranked feed for a stored viewer. */
    public List<ScoredPost> forYou(String viewerId, int limit) {
        Viewer viewer = requireViewer(viewerId);
        RankingConfig config = configStore.get(viewerId);
        List<Post> candidates = postStore.findAll();

        List<ScoredPost> feed = assembler.generateFeed(candidates, viewer, config, viewerDirectory, limit);
        log.info("Built for-you feed for viewer {}: {} items from {} candidates",
            viewerId, feed.size(), candidates.size());
        return feed;
    }

    /** Posts by followed authors only, newest first, unscored. */
    public List<Post> latest(String viewerId, int limit) {
        Viewer viewer = requireViewer(viewerId);
        if (limit <= 0 || viewer.following().isEmpty()) {
            return List.of();
        }
        return postStore.findByAuthors(viewer.following()).stream()
            .sorted(Comparator.comparing(Post::createdAt).reversed())
            .limit(limit)
            .toList();
    }

    /**
     * Ranks caller-supplied candidates without touching the stores.
     * Authors missing from {@code authors} simply get no handle in the explanation.
     */
    public List<ScoredPost> rank(List<Post> candidates, Viewer viewer, RankingConfig config,
                                 List<AuthorProfile> authors, int limit) {
        if (viewer == null || viewer.id() == null || viewer.id().isBlank()) {
            throw new IllegalArgumentException("viewer with id is required");
        }
        AuthorLookup lookup = authors != null && !authors.isEmpty()
            ? AuthorLookup.of(authors)
            : AuthorLookup.none();
        return assembler.generateFeed(candidates, viewer, config, lookup, limit);
    }

    private Viewer requireViewer(String viewerId) {
        return viewerDirectory.findById(viewerId)
            .orElseThrow(() -> new ViewerNotFoundException(viewerId));
    }
}
