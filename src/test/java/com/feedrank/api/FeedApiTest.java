package com.feedrank.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.feedrank.model.AuthorProfile;
import com.feedrank.model.Post;
import com.feedrank.model.RankingConfig;
import com.feedrank.model.Viewer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class FeedApiTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper mapper;

    @Test
    void statelessRanking_returnsScoredItemsWithExplanations() throws Exception {
        Instant now = Instant.now();
        Post followed = Post.builder("p-1", "alice", now.minus(Duration.ofHours(1))).commentCount(100).build();
        Post own = Post.builder("p-2", "viewer-1", now).build();
        RankingRequest request = new RankingRequest(
            List.of(followed, own),
            new Viewer("viewer-1", null, Set.of("alice"), List.of(), null),
            null,
            List.of(new AuthorProfile("alice", "alice")),
            10);

        mvc.perform(post("/v1/rankings")
                .contentType(MediaType.APPLICATION_JSON)
                .content(mapper.writeValueAsString(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.viewer_id").value("viewer-1"))
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.items", hasSize(1)))
            .andExpect(jsonPath("$.items[0].post.id").value("p-1"))
            .andExpect(jsonPath("$.items[0].explanation").value("Because: you follow @alice + active conversation"));
    }

    @Test
    void storedFlow_postsViewerConfigAndFeed() throws Exception {
        Instant now = Instant.now();
        mvc.perform(put("/v1/viewers/viewer-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"handle\":\"viewer\",\"following\":[\"alice\"],\"interests\":[\"jazz\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("viewer-1"));

        mvc.perform(put("/v1/viewers/viewer-1/ranking-config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"following_weight\":\"heavy\",\"muted_topics\":[\"crypto\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.following_weight").value("heavy"))
            .andExpect(jsonPath("$.time_window_days").value(7));

        String body = mapper.writeValueAsString(Post.builder("p-1", "bob", now.minus(Duration.ofHours(1)))
            .semanticTopics(List.of("Jazz"))
            .build());
        mvc.perform(post("/v1/posts").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.post_id").value("p-1"));

        mvc.perform(put("/v1/posts/p-1/assessment")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value_score\":{\"total\":0.2,\"confidence\":0.9},\"fact_check_status\":\"needs_review\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fact_check_status").value("needs_review"));

        mvc.perform(get("/v1/feeds/viewer-1/for-you").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.feed_type").value("for_you"))
            .andExpect(jsonPath("$.items[0].post.id").value("p-1"))
            .andExpect(jsonPath("$.items[0].explanation").value(
                "Because: matches your interest \"Jazz\" + low value content + fact-check needs review"));
    }

    @Test
    void duplicatePost_isConflict() throws Exception {
        String body = mapper.writeValueAsString(Post.builder("dup", "bob", Instant.now()).build());
        mvc.perform(post("/v1/posts").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated());
        mvc.perform(post("/v1/posts").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error_code").value("DUPLICATE_POST"));
    }

    @Test
    void unknownViewerFeed_isNotFound() throws Exception {
        mvc.perform(get("/v1/feeds/ghost/for-you"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("VIEWER_NOT_FOUND"));
    }

    @Test
    void unknownPost_isNotFoundWithPostErrorCode() throws Exception {
        mvc.perform(get("/v1/posts/ghost"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("POST_NOT_FOUND"))
            .andExpect(jsonPath("$.message").value("post not found: ghost"));

        mvc.perform(put("/v1/posts/ghost/assessment")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fact_check_status\":\"blocked\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("POST_NOT_FOUND"));

        mvc.perform(get("/v1/viewers/ghost/ranking-config"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("VIEWER_NOT_FOUND"));
    }

    @Test
    void invalidConfig_isBadRequest() throws Exception {
        mvc.perform(put("/v1/viewers/viewer-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(mapper.writeValueAsString(Map.of("handle", "v"))))
            .andExpect(status().isOk());

        mvc.perform(put("/v1/viewers/viewer-1/ranking-config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"semantic_similarity_threshold\":1.4}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    void unknownEnumValue_isBadRequest() throws Exception {
        mvc.perform(post("/v1/rankings")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"viewer\":{\"id\":\"v\"},\"config\":{\"following_weight\":\"extreme\"}}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void defaultConfig_isServedForNewViewer() throws Exception {
        mvc.perform(put("/v1/viewers/viewer-2")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isOk());

        mvc.perform(get("/v1/viewers/viewer-2/ranking-config"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.following_weight").value("medium"))
            .andExpect(jsonPath("$.semantic_similarity_threshold").value(RankingConfig.DEFAULT_SIMILARITY_THRESHOLD));
    }
}
