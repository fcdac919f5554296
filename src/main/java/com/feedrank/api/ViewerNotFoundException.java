package com.feedrank.api;

public class ViewerNotFoundException extends FeedResourceNotFoundException {

    public ViewerNotFoundException(String viewerId) {
        super("VIEWER_NOT_FOUND", "viewer not found: " + viewerId);
    }
}
