package com.github.dimitryivaniuta.content.publishing.web.dto;

import jakarta.validation.constraints.Size;

/**
 * @param content replacement content; omit to keep the current text and only reopen the post
 */
public record EditRequest(@Size(max = 10_000) String content) {}
