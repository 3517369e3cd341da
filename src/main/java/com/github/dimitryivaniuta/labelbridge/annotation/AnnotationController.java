package com.github.dimitryivaniuta.labelbridge.annotation;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.web.RequestContextKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/organizations/{orgId}/projects/{projectId}")
@RequiredArgsConstructor
public class AnnotationController {

    private final AnnotationWorkspaceService workspace;

    @PostMapping("/annotation-session")
    public AnnotationSessionView openSession(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable Long orgId,
            @PathVariable Long projectId) {
        return workspace.openSession(principal, orgId, projectId);
    }

    @DeleteMapping("/annotation-session")
    public ResponseEntity<Void> closeSession(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable Long orgId,
            @PathVariable Long projectId) {
        workspace.closeSession(principal, orgId, projectId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/tasks")
    public JsonNode tasks(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable Long orgId,
            @PathVariable Long projectId) {
        return workspace.listTasks(principal, orgId, projectId);
    }

    @PostMapping("/datasets/{datasetId}/tasks")
    public ImportResult importTasks(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable Long orgId,
            @PathVariable Long projectId,
            @PathVariable Long datasetId,
            @RequestBody JsonNode tasks) {
        return workspace.importTasks(principal, orgId, projectId, datasetId, tasks);
    }
}
