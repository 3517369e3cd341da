package com.github.dimitryivaniuta.labelbridge.auth;

import com.github.dimitryivaniuta.labelbridge.audit.AuditEvent;
import com.github.dimitryivaniuta.labelbridge.audit.AuditEventKind;
import com.github.dimitryivaniuta.labelbridge.audit.AuditLog;
import com.github.dimitryivaniuta.labelbridge.auth.dto.PrincipalView;
import com.github.dimitryivaniuta.labelbridge.auth.dto.RegisterRequest;
import com.github.dimitryivaniuta.labelbridge.auth.dto.TokenResponse;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticationFailedException;
import com.github.dimitryivaniuta.labelbridge.credential.CredentialStore;
import com.github.dimitryivaniuta.labelbridge.credential.Principal;
import com.github.dimitryivaniuta.labelbridge.credential.PrivilegeChange;
import com.github.dimitryivaniuta.labelbridge.credential.RoleGrant;
import com.github.dimitryivaniuta.labelbridge.tenancy.TenancyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.Set;

/**
 * Login, logout, registration and secret changes. Failures surface as
 * {@link AuthenticationFailedException}; the HTTP layer turns them all into the same 401.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final CredentialStore credentialStore;
    private final AccessTokenService tokens;
    private final TenancyService tenancy;
    private final AuditLog auditLog;

    public TokenResponse login(String identifier, String secret) {
        Principal principal;
        try {
            principal = credentialStore.verify(identifier, secret);
        } catch (AuthenticationFailedException ex) {
            auditLog.record(AuditEvent.deny(null, AuditEventKind.LOGIN, null, ex.kind()));
            throw ex;
        }
        credentialStore.recordLogin(principal.getId());
        auditLog.record(AuditEvent.allow(principal.getId(), AuditEventKind.LOGIN, null));
        return tokenFor(principal.getId(), principal.getTokenGeneration(), view(principal));
    }

    /** Invalidates every token of the caller; bridged sessions are revoked by the resulting event. */
    public void logout(AuthenticatedPrincipal principal) {
        credentialStore.bumpTokenGeneration(principal.id(), PrivilegeChange.LOGGED_OUT);
        auditLog.record(AuditEvent.allow(principal.id(), AuditEventKind.LOGOUT, null));
    }

    @Transactional
    public TokenResponse register(RegisterRequest req) {
        if (credentialStore.exists(req.identifier())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Identifier already registered");
        }
        Principal principal;
        try {
            principal = credentialStore.create(req.identifier(), req.displayName().trim(), req.secret(), false);
        } catch (DataIntegrityViolationException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Identifier already registered");
        }
        String ref = null;
        if (req.organizationName() != null && !req.organizationName().isBlank()) {
            Long orgId = tenancy.createOrganization(req.organizationName(), null, principal.getId()).getId();
            ref = "org:" + orgId;
        }
        auditLog.record(AuditEvent.allow(principal.getId(), AuditEventKind.REGISTRATION, ref));
        return tokenFor(principal.getId(), principal.getTokenGeneration(), view(principal));
    }

    /**
     * Verifies the current secret, rotates it, and hands back a token of the new generation since
     * the caller's old one stops working.
     */
    public TokenResponse changeSecret(AuthenticatedPrincipal principal, String currentSecret, String newSecret) {
        try {
            credentialStore.verify(principal.identifier(), currentSecret);
        } catch (AuthenticationFailedException ex) {
            auditLog.record(AuditEvent.deny(principal.id(), AuditEventKind.SECRET_ROTATION, null, ex.kind()));
            throw ex;
        }
        long generation = credentialStore.rotateSecret(principal.id(), newSecret);
        auditLog.record(AuditEvent.allow(principal.id(), AuditEventKind.SECRET_ROTATION, null));
        return tokenFor(principal.id(), generation, view(principal));
    }

    public PrincipalView view(AuthenticatedPrincipal principal) {
        return new PrincipalView(principal.id(), principal.identifier(), principal.displayName(),
                principal.platformOperator(), PrincipalView.memberships(principal.grants()));
    }

    private PrincipalView view(Principal principal) {
        Set<RoleGrant> grants = credentialStore.rolesFor(principal.getId());
        return new PrincipalView(principal.getId(), principal.getIdentifier(), principal.getDisplayName(),
                principal.isPlatformOperator(), PrincipalView.memberships(grants));
    }

    private TokenResponse tokenFor(Long principalId, long generation, PrincipalView view) {
        IssuedToken token = tokens.issue(principalId, generation);
        return new TokenResponse(token.token(), token.expiresAt(), view);
    }
}
