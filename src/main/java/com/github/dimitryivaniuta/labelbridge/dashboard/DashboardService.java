package com.github.dimitryivaniuta.labelbridge.dashboard;

import com.github.dimitryivaniuta.labelbridge.authz.AccessDecision;
import com.github.dimitryivaniuta.labelbridge.authz.Action;
import com.github.dimitryivaniuta.labelbridge.authz.AuthorizationEngine;
import com.github.dimitryivaniuta.labelbridge.authz.ResourcePath;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.credential.RoleBindingRepository;
import com.github.dimitryivaniuta.labelbridge.tenancy.DatasetRepository;
import com.github.dimitryivaniuta.labelbridge.tenancy.Organization;
import com.github.dimitryivaniuta.labelbridge.tenancy.ProjectRepository;
import com.github.dimitryivaniuta.labelbridge.tenancy.TenancyService;
import com.github.dimitryivaniuta.labelbridge.tenancy.TenantStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class DashboardService {

    private static final String COUNTS_CACHE = "dashboardOrgCounts:ttl=60:max=10000"; // counts only, never decisions

    private final TenancyService tenancy;
    private final AuthorizationEngine authorizationEngine;
    private final ProjectRepository projects;
    private final DatasetRepository datasets;
    private final RoleBindingRepository bindings;
    private final CacheManager cacheManager;
    private final Clock clock;

    /**
     * Every organization is authorized for {@code READ} individually; organizations that no longer
     * resolve (suspended) are skipped rather than failing the whole dashboard.
     */
    public DashboardStats stats(AuthenticatedPrincipal principal) {
        List<DashboardStats.OrganizationStats> rows = new ArrayList<>();
        for (Organization org : tenancy.organizationsFor(principal)) {
            AccessDecision decision = authorizationEngine.authorize(
                    principal, ResourcePath.organization(org.getId()), Action.READ);
            if (!decision.permitted()) {
                continue;
            }
            Counts c = counts(org.getId());
            rows.add(new DashboardStats.OrganizationStats(
                    org.getId(),
                    org.getName(),
                    decision.effectiveRole() == null ? null : decision.effectiveRole().tag(),
                    c.projects(), c.activeProjects(), c.datasets(), c.items(), c.members()));
        }

        long projectsTotal = 0, active = 0, datasetsTotal = 0, items = 0;
        for (DashboardStats.OrganizationStats r : rows) {
            projectsTotal += r.projects();
            active += r.activeProjects();
            datasetsTotal += r.datasets();
            items += r.items();
        }
        return new DashboardStats(rows.size(), projectsTotal, active, datasetsTotal, items, rows, clock.instant());
    }

    private Counts counts(Long organizationId) {
        Cache cache = cacheManager.getCache(COUNTS_CACHE);
        if (cache != null) {
            Counts cached = cache.get(organizationId, Counts.class);
            if (cached != null) return cached;
        }
        Counts loaded = new Counts(
                projects.countByOrganization_Id(organizationId),
                projects.countByOrganizationAndStatus(organizationId, TenantStatus.ACTIVE),
                datasets.countByOrganization(organizationId),
                datasets.sumItemsByOrganization(organizationId),
                bindings.countMembers(organizationId));
        if (cache != null) cache.put(organizationId, loaded);
        return loaded;
    }

    record Counts(long projects, long activeProjects, long datasets, long items, long members) {}
}
