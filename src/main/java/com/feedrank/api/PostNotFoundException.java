package com.feedrank.api;

public class PostNotFoundException extends FeedResourceNotFoundException {

    public PostNotFoundException(String postId) {
        super("POST_NOT_FOUND", "post not found: " + postId);
    }
}
