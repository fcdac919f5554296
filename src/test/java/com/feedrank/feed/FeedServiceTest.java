package com.feedrank.feed;

import com.feedrank.api.ViewerNotFoundException;
import com.feedrank.assembly.FeedAssembler;
import com.feedrank.config.FeedProperties;
import com.feedrank.eligibility.EligibilityFilter;
import com.feedrank.model.AuthorProfile;
import com.feedrank.model.Post;
import com.feedrank.model.RankingConfig;
import com.feedrank.model.ScoredPost;
import com.feedrank.model.Viewer;
import com.feedrank.scoring.FeedScorer;
import com.feedrank.store.InMemoryPostStore;
import com.feedrank.store.RankingConfigStore;
import com.feedrank.store.ViewerDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FeedServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private InMemoryPostStore postStore;
    private ViewerDirectory viewers;
    private RankingConfigStore configs;
    private FeedService service;

    @BeforeEach
    void setUp() {
        postStore = new InMemoryPostStore();
        viewers = new ViewerDirectory();
        configs = new RankingConfigStore(new FeedProperties());
        FeedAssembler assembler = new FeedAssembler(
            new EligibilityFilter(EligibilityFilter.defaultRules()),
            new FeedScorer(FeedScorer.defaultSignals()),
            Clock.fixed(NOW, ZoneOffset.UTC));
        service = new FeedService(assembler, postStore, viewers, configs);
    }

    @Test
    void forYou_appliesSavedMutedTopics() {
        viewers.upsert(Viewer.of("viewer-1"));
        configs.put("viewer-1", RankingConfig.defaults().withMutedTopics(List.of("crypto")));
        postStore.save(Post.builder("keep", "bob", NOW.minus(Duration.ofHours(3))).topic("jazz").build());
        postStore.save(Post.builder("drop", "bob", NOW.minus(Duration.ofHours(1))).topic("crypto").build());

        List<ScoredPost> feed = service.forYou("viewer-1", 10);

        assertEquals(List.of("keep"), feed.stream().map(s -> s.post().id()).toList());
    }

    @Test
    void forYou_respectsLimit() {
        viewers.upsert(Viewer.of("viewer-1"));
        for (int i = 0; i < 5; i++) {
            postStore.save(Post.builder("p-" + i, "author-" + i, NOW.minus(Duration.ofHours(i + 1))).build());
        }

        assertEquals(2, service.forYou("viewer-1", 2).size());
        assertTrue(service.forYou("viewer-1", 0).isEmpty());
    }

    @Test
    void forYou_unknownViewerFails() {
        assertThrows(ViewerNotFoundException.class, () -> service.forYou("ghost", 10));
    }

    @Test
    void latest_withoutFollowsIsEmpty() {
        viewers.upsert(Viewer.of("viewer-1"));
        postStore.save(Post.builder("p-1", "bob", NOW).build());

        assertTrue(service.latest("viewer-1", 10).isEmpty());
    }

    @Test
    void rank_usesSuppliedAuthorsAndIgnoresStores() {
        postStore.save(Post.builder("stored", "alice", NOW).build());
        Viewer viewer = new Viewer("viewer-1", null, Set.of("alice"), List.of(), null);
        Post candidate = Post.builder("supplied", "alice", NOW.minus(Duration.ofHours(1))).build();

        List<ScoredPost> ranked = service.rank(List.of(candidate), viewer, null,
            List.of(new AuthorProfile("alice", "alice")), 10);

        assertEquals(1, ranked.size());
        assertEquals("supplied", ranked.get(0).post().id());
        assertEquals("Because: you follow @alice", ranked.get(0).explanation());
    }

    @Test
    void rank_requiresViewerId() {
        assertThrows(IllegalArgumentException.class,
            () -> service.rank(List.of(), Viewer.of(" "), null, List.of(), 10));
        assertThrows(IllegalArgumentException.class,
            () -> service.rank(List.of(), null, null, List.of(), 10));
    }
}
