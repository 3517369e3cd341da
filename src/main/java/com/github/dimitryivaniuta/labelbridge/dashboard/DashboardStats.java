package com.github.dimitryivaniuta.labelbridge.dashboard;

import java.time.Instant;
import java.util.List;

/**
 * Totals across the caller's organizations plus the per-organization breakdown they add up from.
 */
public record DashboardStats(
        int totalOrganizations,
        long totalProjects,
        long activeProjects,
        long totalDatasets,
        long totalItems,
        List<OrganizationStats> organizations,
        Instant generatedAt
) {

    public record OrganizationStats(
            Long organizationId,
            String name,
            String role,
            long projects,
            long activeProjects,
            long datasets,
            long items,
            long members
    ) {}
}
