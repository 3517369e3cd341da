package com.github.dimitryivaniuta.labelbridge.tenancy.dto;

import com.github.dimitryivaniuta.labelbridge.tenancy.Organization;

import java.time.Instant;

public record OrganizationResponse(Long id, String name, String description, String status, Instant createdAt) {

    public static OrganizationResponse from(Organization o) {
        return new OrganizationResponse(o.getId(), o.getName(), o.getDescription(), o.getStatus().name(), o.getCreatedAt());
    }
}
