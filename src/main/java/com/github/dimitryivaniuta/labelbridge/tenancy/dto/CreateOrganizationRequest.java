package com.github.dimitryivaniuta.labelbridge.tenancy.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateOrganizationRequest(
        @NotBlank @Size(max = 255) String name,
        @Size(max = 1024) String description
) {}
