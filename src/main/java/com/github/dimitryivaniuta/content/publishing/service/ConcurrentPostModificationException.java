package com.github.dimitryivaniuta.content.publishing.service;

/**
 * Thrown when a post changed between being read and being written, typically because the
 * scheduler claimed it while a human command was in flight. The caller may reload and retry.
 */
public class ConcurrentPostModificationException extends RuntimeException {

    private final String postId;

    public ConcurrentPostModificationException(String postId) {
        super("Post " + postId + " was modified concurrently; reload and retry");
        this.postId = postId;
    }

    public String getPostId() {
        return postId;
    }
}
