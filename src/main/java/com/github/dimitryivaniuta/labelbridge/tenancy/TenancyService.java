package com.github.dimitryivaniuta.labelbridge.tenancy;

import com.github.dimitryivaniuta.labelbridge.authz.Role;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.credential.RoleBinding;
import com.github.dimitryivaniuta.labelbridge.credential.RoleBindingRepository;
import com.github.dimitryivaniuta.labelbridge.credential.RoleGrant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

@Slf4j
@Service
@RequiredArgsConstructor
public class TenancyService {

    private final OrganizationRepository organizations;
    private final ProjectRepository projects;
    private final DatasetRepository datasets;
    private final RoleBindingRepository bindings;

    /** Creates the organization and binds the creator as its owner. */
    @Transactional
    public Organization createOrganization(String name, String description, Long creatorId) {
        Organization org = organizations.save(Organization.builder()
                .name(name.trim())
                .description(description)
                .createdBy(creatorId)
                .build());
        bindings.save(RoleBinding.builder()
                .principalId(creatorId)
                .organizationId(org.getId())
                .role(Role.OWNER)
                .assignedBy(creatorId)
                .build());
        log.info("Organization {} created by principal {}", org.getId(), creatorId);
        return org;
    }

    @Transactional
    public Project createProject(Long organizationId, String name, String description,
                                 Long engineProjectId, Long creatorId) {
        Organization org = organizations.findById(organizationId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Not found"));
        return projects.save(Project.builder()
                .organization(org)
                .name(name.trim())
                .description(description)
                .engineProjectId(engineProjectId)
                .createdBy(creatorId)
                .build());
    }

    @Transactional
    public Dataset createDataset(Long organizationId, Long projectId, String name, Long creatorId) {
        Project project = projects.findByIdAndOrganization_Id(projectId, organizationId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Not found"));
        return datasets.save(Dataset.builder()
                .project(project)
                .name(name.trim())
                .createdBy(creatorId)
                .build());
    }

    @Transactional
    public void addImportedItems(Long datasetId, long count) {
        if (count > 0) {
            datasets.addItems(datasetId, count);
        }
    }

    /**
     * Organizations visible on the caller's dashboard: every organization for platform operators,
     * otherwise those the caller holds any binding in.
     */
    @Transactional(readOnly = true)
    public List<Organization> organizationsFor(AuthenticatedPrincipal principal) {
        if (principal.platformOperator()) {
            return organizations.findAllByOrderByIdAsc();
        }
        Set<Long> ids = new TreeSet<>();
        for (RoleGrant g : principal.grants()) {
            ids.add(g.organizationId());
        }
        return ids.isEmpty() ? List.of() : organizations.findByIdInOrderByIdAsc(ids);
    }
}
