package com.github.dimitryivaniuta.labelbridge.tenancy;

import com.github.dimitryivaniuta.labelbridge.audit.AuditEvent;
import com.github.dimitryivaniuta.labelbridge.audit.AuditEventKind;
import com.github.dimitryivaniuta.labelbridge.audit.AuditLog;
import com.github.dimitryivaniuta.labelbridge.authz.Role;
import com.github.dimitryivaniuta.labelbridge.credential.CredentialStore;
import com.github.dimitryivaniuta.labelbridge.credential.Principal;
import com.github.dimitryivaniuta.labelbridge.credential.PrincipalPrivilegesChangedEvent;
import com.github.dimitryivaniuta.labelbridge.credential.PrincipalRepository;
import com.github.dimitryivaniuta.labelbridge.credential.PrivilegeChange;
import com.github.dimitryivaniuta.labelbridge.credential.RoleBinding;
import com.github.dimitryivaniuta.labelbridge.credential.RoleBindingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;

/**
 * Role administration inside an organization. Callers are expected to have been authorized for
 * {@code ADMIN} on the organization already. Every change publishes
 * {@link PrincipalPrivilegesChangedEvent} for the affected principal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipService {

    private final PrincipalRepository principals;
    private final RoleBindingRepository bindings;
    private final ProjectRepository projects;
    private final CredentialStore credentialStore;
    private final ApplicationEventPublisher events;
    private final AuditLog auditLog;

    /**
     * Creates or changes the principal's binding, organization-wide or narrowed to one project.
     *
     * @return the resulting binding
     */
    @Transactional
    public RoleBinding assignRole(Long actorId, Long organizationId, Long principalId, Role role, Long projectId) {
        Principal target = principals.findById(principalId)
                .filter(Principal::isActive)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Not found"));
        if (projectId != null && projects.findByIdAndOrganization_Id(projectId, organizationId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Not found");
        }

        Optional<RoleBinding> existing = projectId == null
                ? bindings.findByPrincipalIdAndOrganizationIdAndProjectIdIsNull(principalId, organizationId)
                : bindings.findByPrincipalIdAndOrganizationIdAndProjectId(principalId, organizationId, projectId);

        if (existing.isPresent() && existing.get().getRole() == role) {
            return existing.get();
        }
        if (existing.isPresent() && projectId == null && existing.get().getRole() == Role.OWNER) {
            requireAnotherOwner(organizationId);
        }

        RoleBinding binding = existing.orElseGet(() -> RoleBinding.builder()
                .principalId(target.getId())
                .organizationId(organizationId)
                .projectId(projectId)
                .build());
        Role previous = binding.getRole();
        binding.setRole(role);
        binding.setAssignedBy(actorId);
        RoleBinding saved = bindings.save(binding);

        log.info("Principal {} set role of {} in org {} (project {}) from {} to {}",
                actorId, principalId, organizationId, projectId, previous, role);
        auditLog.record(AuditEvent.allow(actorId, AuditEventKind.ROLE_CHANGE,
                ref(organizationId, projectId, principalId) + " role:" + role.tag()));
        events.publishEvent(new PrincipalPrivilegesChangedEvent(principalId, PrivilegeChange.ROLE_CHANGED));
        return saved;
    }

    /** Removes every binding the principal holds in the organization. */
    @Transactional
    public void removeMember(Long actorId, Long organizationId, Long principalId) {
        bindings.findByPrincipalIdAndOrganizationIdAndProjectIdIsNull(principalId, organizationId)
                .filter(b -> b.getRole() == Role.OWNER)
                .ifPresent(b -> requireAnotherOwner(organizationId));

        int removed = bindings.deleteByPrincipalAndOrganization(principalId, organizationId);
        if (removed == 0) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Not found");
        }
        log.info("Principal {} removed {} binding(s) of {} in org {}", actorId, removed, principalId, organizationId);
        auditLog.record(AuditEvent.allow(actorId, AuditEventKind.ROLE_CHANGE,
                ref(organizationId, null, principalId) + " removed"));
        events.publishEvent(new PrincipalPrivilegesChangedEvent(principalId, PrivilegeChange.ROLE_REMOVED));
    }

    /**
     * Deactivates a member account. The principal is kept; its tokens and sessions die.
     */
    @Transactional
    public void deactivateMember(Long actorId, Long organizationId, Long principalId) {
        if (actorId.equals(principalId)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Cannot deactivate yourself");
        }
        if (!bindings.existsByPrincipalIdAndOrganizationId(principalId, organizationId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Not found");
        }
        credentialStore.deactivate(principalId);
        auditLog.record(AuditEvent.allow(actorId, AuditEventKind.PRINCIPAL_DEACTIVATED,
                ref(organizationId, null, principalId)));
    }

    @Transactional(readOnly = true)
    public long memberCount(Long organizationId) {
        return bindings.countMembers(organizationId);
    }

    private void requireAnotherOwner(Long organizationId) {
        if (bindings.countByOrganizationIdAndProjectIdIsNullAndRole(organizationId, Role.OWNER) <= 1) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Organization must keep at least one owner");
        }
    }

    private static String ref(Long organizationId, Long projectId, Long principalId) {
        String base = "org:" + organizationId;
        if (projectId != null) base += "/project:" + projectId;
        return base + " principal:" + principalId;
    }
}
