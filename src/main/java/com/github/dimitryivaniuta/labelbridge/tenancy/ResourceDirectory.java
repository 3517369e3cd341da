package com.github.dimitryivaniuta.labelbridge.tenancy;

import com.github.dimitryivaniuta.labelbridge.authz.ResourcePath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Resolves a {@link ResourcePath} against the tenant tables. A path resolves only if every
 * segment exists and belongs to its parent, and the organization is active.
 */
@Service
@RequiredArgsConstructor
public class ResourceDirectory {

    private final OrganizationRepository organizations;
    private final ProjectRepository projects;
    private final DatasetRepository datasets;

    @Transactional(readOnly = true)
    public boolean resolves(ResourcePath path) {
        Organization org = organizations.findById(path.organizationId()).orElse(null);
        if (org == null || !org.isActive()) {
            return false;
        }
        if (path.projectId() == null) {
            return true;
        }
        if (projects.findByIdAndOrganization_Id(path.projectId(), org.getId()).isEmpty()) {
            return false;
        }
        return path.datasetId() == null
                || datasets.findByIdAndProject_Id(path.datasetId(), path.projectId()).isPresent();
    }

    @Transactional(readOnly = true)
    public Optional<Long> engineProjectId(ResourcePath path) {
        if (path.projectId() == null) {
            return Optional.empty();
        }
        return projects.findByIdAndOrganization_Id(path.projectId(), path.organizationId())
                .map(Project::getEngineProjectId);
    }
}
