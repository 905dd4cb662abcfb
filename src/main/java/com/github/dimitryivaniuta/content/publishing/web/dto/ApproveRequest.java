package com.github.dimitryivaniuta.content.publishing.web.dto;

import jakarta.validation.constraints.Size;

/**
 * @param approvedBy reviewer; {@code system} when omitted
 */
public record ApproveRequest(@Size(max = 128) String approvedBy) {}
