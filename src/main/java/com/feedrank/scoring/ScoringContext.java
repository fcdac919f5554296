package com.feedrank.scoring;

import com.feedrank.model.AuthorLookup;
import com.feedrank.model.Post;
import com.feedrank.model.RankingConfig;
import com.feedrank.model.Viewer;

import java.time.Instant;
import java.util.List;

/**
 * Inputs shared by every scoring signal for one (post, viewer) pair.
 * {@code now} is fixed for the whole ranking call.
 */
public record ScoringContext(
    Post post,
    Viewer viewer,
    RankingConfig config,
    List<Post> candidatePool,
    AuthorLookup authorLookup,
    Instant now
) {}
