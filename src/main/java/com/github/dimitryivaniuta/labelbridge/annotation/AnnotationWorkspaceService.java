package com.github.dimitryivaniuta.labelbridge.annotation;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.labelbridge.authz.Action;
import com.github.dimitryivaniuta.labelbridge.authz.ResourcePath;
import com.github.dimitryivaniuta.labelbridge.bridge.AnnotationEngineClient;
import com.github.dimitryivaniuta.labelbridge.bridge.SessionBridge;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.gateway.RequestGateway;
import com.github.dimitryivaniuta.labelbridge.tenancy.TenancyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/**
 * Engine-backed operations on a project, each run through {@link RequestGateway#bridged}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnnotationWorkspaceService {

    private final RequestGateway gateway;
    private final SessionBridge sessionBridge;
    private final AnnotationEngineClient engine;
    private final TenancyService tenancy;

    public AnnotationSessionView openSession(AuthenticatedPrincipal principal, Long orgId, Long projectId) {
        return gateway.bridged(principal, ResourcePath.project(orgId, projectId), Action.WRITE,
                ctx -> AnnotationSessionView.from(ctx.session()));
    }

    /** Revokes the caller's own session on the project; a no-op if there is none. */
    public void closeSession(AuthenticatedPrincipal principal, Long orgId, Long projectId) {
        gateway.authorize(principal, ResourcePath.project(orgId, projectId), Action.READ,
                decision -> sessionBridge.revoke(principal.id(), projectId));
    }

    public JsonNode listTasks(AuthenticatedPrincipal principal, Long orgId, Long projectId) {
        return gateway.bridged(principal, ResourcePath.project(orgId, projectId), Action.READ,
                ctx -> engine.listTasks(ctx.engineProjectId(), ctx.sessionToken()));
    }

    public ImportResult importTasks(AuthenticatedPrincipal principal, Long orgId, Long projectId,
                                    Long datasetId, JsonNode tasks) {
        if (tasks == null || !tasks.isArray()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "tasks must be a JSON array");
        }
        ResourcePath path = ResourcePath.dataset(orgId, projectId, datasetId);
        return gateway.bridged(principal, path, Action.MANAGE, ctx -> {
            int imported = engine.importTasks(ctx.engineProjectId(), ctx.sessionToken(), tasks);
            tenancy.addImportedItems(datasetId, imported);
            log.info("Imported {} of {} task(s) into dataset {} of project {}", imported, tasks.size(), datasetId, projectId);
            return new ImportResult(datasetId, tasks.size(), imported);
        });
    }
}
