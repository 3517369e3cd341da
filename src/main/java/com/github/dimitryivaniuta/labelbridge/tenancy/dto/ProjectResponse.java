package com.github.dimitryivaniuta.labelbridge.tenancy.dto;

import com.github.dimitryivaniuta.labelbridge.tenancy.Project;

import java.time.Instant;

public record ProjectResponse(Long id, Long organizationId, String name, String description,
                              String status, Long engineProjectId, Instant createdAt) {

    public static ProjectResponse from(Project p, Long organizationId) {
        return new ProjectResponse(p.getId(), organizationId, p.getName(), p.getDescription(),
                p.getStatus().name(), p.getEngineProjectId(), p.getCreatedAt());
    }
}
