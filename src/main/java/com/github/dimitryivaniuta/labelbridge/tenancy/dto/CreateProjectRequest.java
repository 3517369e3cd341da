package com.github.dimitryivaniuta.labelbridge.tenancy.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * @param engineProjectId id of the already provisioned project in the annotation engine, optional
 */
public record CreateProjectRequest(
        @NotBlank @Size(max = 255) String name,
        @Size(max = 1024) String description,
        @Positive Long engineProjectId
) {}
