package com.feedrank.api;

/**
 * Thrown when a post is submitted with an id that is already stored.
 */
public class DuplicatePostException extends RuntimeException {

    public DuplicatePostException(String postId) {
        super("post id already exists: " + postId);
    }
}
