package com.github.dimitryivaniuta.labelbridge.tenancy;

import com.github.dimitryivaniuta.labelbridge.authz.Action;
import com.github.dimitryivaniuta.labelbridge.authz.ResourcePath;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.gateway.RequestGateway;
import com.github.dimitryivaniuta.labelbridge.tenancy.dto.*;
import com.github.dimitryivaniuta.labelbridge.web.RequestContextKeys;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/organizations")
@RequiredArgsConstructor
public class TenancyController {

    private final TenancyService tenancy;
    private final RequestGateway gateway;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public OrganizationResponse createOrganization(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @Valid @RequestBody CreateOrganizationRequest req) {
        return OrganizationResponse.from(tenancy.createOrganization(req.name(), req.description(), principal.id()));
    }

    @PostMapping("/{orgId}/projects")
    @ResponseStatus(HttpStatus.CREATED)
    public ProjectResponse createProject(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable Long orgId,
            @Valid @RequestBody CreateProjectRequest req) {
        return gateway.authorize(principal, ResourcePath.organization(orgId), Action.MANAGE, decision ->
                ProjectResponse.from(
                        tenancy.createProject(orgId, req.name(), req.description(), req.engineProjectId(), principal.id()),
                        orgId));
    }

    @PostMapping("/{orgId}/projects/{projectId}/datasets")
    @ResponseStatus(HttpStatus.CREATED)
    public DatasetResponse createDataset(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable Long orgId,
            @PathVariable Long projectId,
            @Valid @RequestBody CreateDatasetRequest req) {
        return gateway.authorize(principal, ResourcePath.project(orgId, projectId), Action.MANAGE, decision ->
                DatasetResponse.from(tenancy.createDataset(orgId, projectId, req.name(), principal.id()), projectId));
    }
}
