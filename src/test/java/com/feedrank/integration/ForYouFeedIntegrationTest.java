package com.feedrank.integration;

import com.feedrank.api.ViewerNotFoundException;
import com.feedrank.feed.FeedService;
import com.feedrank.model.FactCheckStatus;
import com.feedrank.model.FollowingWeight;
import com.feedrank.model.Post;
import com.feedrank.model.RankingConfig;
import com.feedrank.model.ScoredPost;
import com.feedrank.model.ValueScore;
import com.feedrank.model.Viewer;
import com.feedrank.store.PostStore;
import com.feedrank.store.RankingConfigStore;
import com.feedrank.store.ViewerDirectory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store-backed feed flow:
 * viewer + config + posts stored -> value pipeline write-back -> ranked for-you feed.
 */
@SpringBootTest
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class ForYouFeedIntegrationTest {

    @Autowired FeedService feedService;
    @Autowired PostStore postStore;
    @Autowired ViewerDirectory viewerDirectory;
    @Autowired RankingConfigStore configStore;

    @Test
    @DisplayName("For-you feed ranks stored posts with the viewer's saved config")
    void forYou_usesStoredViewerConfigAndPosts() {
        Instant now = Instant.now();
        viewerDirectory.upsert(new Viewer("alice", "alice", Set.of(), List.of(), null));
        viewerDirectory.upsert(new Viewer("bob", "bob", Set.of(), List.of(), null));
        viewerDirectory.upsert(new Viewer("viewer-1", "viewer", Set.of("alice"), List.of("jazz"), null));
        configStore.put("viewer-1", new RankingConfig(FollowingWeight.HEAVY, true, List.of(),
            List.of("politics"), 7, 0.7));

        postStore.save(Post.builder("own", "viewer-1", now.minus(Duration.ofMinutes(5))).build());
        postStore.save(Post.builder("from-alice", "alice", now.minus(Duration.ofHours(2))).build());
        postStore.save(Post.builder("from-bob", "bob", now.minus(Duration.ofHours(1))).build());
        postStore.save(Post.builder("muted", "bob", now.minus(Duration.ofHours(1))).topic("politics").build());

        List<ScoredPost> feed = feedService.forYou("viewer-1", 50);

        assertEquals(List.of("from-alice", "from-bob"), feed.stream().map(s -> s.post().id()).toList());
        assertEquals("Because: you follow @alice", feed.get(0).explanation());
    }

    @Test
    @DisplayName("Value pipeline write-back changes the next ranking")
    void assessment_isReflectedInNextFeed() {
        Instant now = Instant.now();
        viewerDirectory.upsert(Viewer.of("viewer-1"));
        postStore.save(Post.builder("first", "bob", now.minus(Duration.ofHours(1))).build());
        postStore.save(Post.builder("second", "carol", now.minus(Duration.ofHours(2))).build());

        List<String> before = feedService.forYou("viewer-1", 50).stream().map(s -> s.post().id()).toList();
        postStore.applyAssessment("second", new ValueScore(0.95, 0.9), FactCheckStatus.CLEAN);
        List<ScoredPost> after = feedService.forYou("viewer-1", 50);

        assertEquals(List.of("first", "second"), before);
        assertEquals("second", after.get(0).post().id());
        assertEquals("Because: high value content", after.get(0).explanation());
    }

    @Test
    @DisplayName("Latest feed lists followed authors only, newest first")
    void latest_listsFollowedAuthorsNewestFirst() {
        Instant now = Instant.now();
        viewerDirectory.upsert(new Viewer("viewer-1", null, Set.of("alice", "bob"), List.of(), null));
        postStore.save(Post.builder("alice-old", "alice", now.minus(Duration.ofDays(40))).build());
        postStore.save(Post.builder("bob-new", "bob", now.minus(Duration.ofMinutes(1))).build());
        postStore.save(Post.builder("carol", "carol", now).build());

        List<Post> latest = feedService.latest("viewer-1", 10);

        assertEquals(List.of("bob-new", "alice-old"), latest.stream().map(Post::id).toList());
    }

    @Test
    void unknownViewer_isRejected() {
        assertThrows(ViewerNotFoundException.class, () -> feedService.forYou("nobody", 10));
        assertThrows(ViewerNotFoundException.class, () -> feedService.latest("nobody", 10));
    }
}
