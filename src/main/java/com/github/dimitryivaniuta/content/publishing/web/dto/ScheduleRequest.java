package com.github.dimitryivaniuta.content.publishing.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * @param scheduledTime publication time (ISO-8601, UTC)
 * @param platform target platform
 */
public record ScheduleRequest(@NotNull Instant scheduledTime, @NotBlank @Size(max = 64) String platform) {}
