package com.github.dimitryivaniuta.content.publishing.web.dto;

import jakarta.validation.constraints.Size;

public record ArchiveRequest(@Size(max = 900) String reason) {}
