package com.github.dimitryivaniuta.content.publishing.web.dto;

import jakarta.validation.constraints.Size;

/**
 * @param rejectedBy reviewer; {@code system} when omitted
 * @param reason why the post was rejected
 */
public record RejectRequest(@Size(max = 128) String rejectedBy, @Size(max = 1024) String reason) {}
