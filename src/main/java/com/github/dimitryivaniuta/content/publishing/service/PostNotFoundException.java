package com.github.dimitryivaniuta.content.publishing.service;

/**
 * Thrown when a command or read targets a post id that does not exist.
 */
public class PostNotFoundException extends RuntimeException {

    private final String postId;

    public PostNotFoundException(String postId) {
        super("Post " + postId + " not found");
        this.postId = postId;
    }

    public String getPostId() {
        return postId;
    }
}
