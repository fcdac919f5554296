package com.feedrank.api;

import com.feedrank.config.FeedProperties;
import com.feedrank.feed.FeedService;
import com.feedrank.model.Post;
import com.feedrank.model.ScoredPost;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Feed reads.
 *
 * GET  /v1/feeds/{viewerId}/for-you
 * GET  /v1/feeds/{viewerId}/latest
 * POST /v1/rankings
 */
@RestController
@RequestMapping("/v1")
public class FeedController {

    private final FeedService feedService;
    private final FeedProperties properties;

    public FeedController(FeedService feedService, FeedProperties properties) {
        this.feedService = feedService;
        this.properties = properties;
    }

    @GetMapping("/feeds/{viewerId}/for-you")
    public FeedResponse forYou(@PathVariable String viewerId,
                               @RequestParam(required = false) Integer limit) {
        List<ScoredPost> items = feedService.forYou(viewerId, properties.getFeed().resolveLimit(limit));
        return FeedResponse.of(viewerId, "for_you", items);
    }

    @GetMapping("/feeds/{viewerId}/latest")
    public List<Post> latest(@PathVariable String viewerId,
                             @RequestParam(required = false) Integer limit) {
        return feedService.latest(viewerId, properties.getFeed().resolveLimit(limit));
    }

    @PostMapping("/rankings")
    public FeedResponse rank(@RequestBody RankingRequest request) {
        if (request.viewer() == null) {
            throw new IllegalArgumentException("viewer is required");
        }
        List<ScoredPost> items = feedService.rank(
            request.candidates(),
            request.viewer(),
            request.config(),
            request.authors(),
            properties.getFeed().resolveLimit(request.limit()));
        return FeedResponse.of(request.viewer().id(), "ranking", items);
    }
}
