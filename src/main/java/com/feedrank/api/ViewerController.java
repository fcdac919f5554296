package com.feedrank.api;

import com.feedrank.model.RankingConfig;
import com.feedrank.model.Viewer;
import com.feedrank.store.RankingConfigStore;
import com.feedrank.store.ViewerDirectory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Objects;

/**
 * Viewer profiles and their personalization settings.
 *
 * PUT /v1/viewers/{viewerId}
 * GET /v1/viewers/{viewerId}
 * GET /v1/viewers/{viewerId}/ranking-config
 * PUT /v1/viewers/{viewerId}/ranking-config
 */
@RestController
@RequestMapping("/v1/viewers")
public class ViewerController {

    private final ViewerDirectory viewerDirectory;
    private final RankingConfigStore configStore;

    public ViewerController(ViewerDirectory viewerDirectory, RankingConfigStore configStore) {
        this.viewerDirectory = viewerDirectory;
        this.configStore = configStore;
    }

    @PutMapping("/{viewerId}")
    public Viewer upsert(@PathVariable String viewerId, @RequestBody Viewer viewer) {
        if (viewer.id() != null && !Objects.equals(viewer.id(), viewerId)) {
            throw new IllegalArgumentException("viewer id in body does not match path");
        }
        return viewerDirectory.upsert(new Viewer(viewerId, viewer.handle(), viewer.following(),
            viewer.interests(), viewer.profileEmbedding()));
    }

    @GetMapping("/{viewerId}")
    public Viewer get(@PathVariable String viewerId) {
        return viewerDirectory.findById(viewerId)
            .orElseThrow(() -> new ViewerNotFoundException(viewerId));
    }

    @GetMapping("/{viewerId}/ranking-config")
    public RankingConfig getConfig(@PathVariable String viewerId) {
        requireViewer(viewerId);
        return configStore.get(viewerId);
    }

    @PutMapping("/{viewerId}/ranking-config")
    public RankingConfig putConfig(@PathVariable String viewerId, @RequestBody RankingConfig config) {
        requireViewer(viewerId);
        return configStore.put(viewerId, config);
    }

    private void requireViewer(String viewerId) {
        if (viewerDirectory.findById(viewerId).isEmpty()) {
            throw new ViewerNotFoundException(viewerId);
        }
    }
}
