package com.github.dimitryivaniuta.labelbridge.credential;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Principals, their hashed secrets and their role bindings.
 *
 * <p>{@link #verify} is a pure read: it never writes audit rows or touches the principal. Failure
 * paths all perform exactly one hash derivation, so response time does not reveal whether an
 * identifier exists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialStore {

    static final String SNAPSHOT_CACHE = "principalSnapshot:ttl=30:max=50000";

    private final PrincipalRepository principals;
    private final RoleBindingRepository bindings;
    private final SecretHashService hashService;
    private final CacheManager cacheManager;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Principal verify(String identifier, String secret) {
        String normalized = normalize(identifier);
        Principal principal = normalized == null ? null : principals.findByIdentifier(normalized).orElse(null);

        if (principal == null) {
            hashService.matchesNothing(secret);
            throw new InvalidCredentialsException("Unknown identifier");
        }
        if (!hashService.matches(secret, principal.getSecretHash())) {
            throw new InvalidCredentialsException("Secret mismatch for principal " + principal.getId());
        }
        // only reported once the secret is proven, otherwise it leaks account state
        if (!principal.isActive()) {
            throw new AccountDisabledException("Principal " + principal.getId() + " is deactivated");
        }
        return principal;
    }

    @Transactional(readOnly = true)
    public Set<RoleGrant> rolesFor(Long principalId) {
        Set<RoleGrant> out = new LinkedHashSet<>();
        for (RoleBinding b : bindings.findByPrincipalId(principalId)) {
            out.add(b.toGrant());
        }
        return out;
    }

    /**
     * Active principal with its grants, cached briefly. Empty for unknown or deactivated principals.
     */
    @SuppressWarnings("unchecked")
    @Transactional(readOnly = true)
    public Optional<AuthenticatedPrincipal> snapshot(Long principalId) {
        Cache cache = cacheManager.getCache(SNAPSHOT_CACHE);
        if (cache != null) {
            Optional<AuthenticatedPrincipal> cached = cache.get(principalId, Optional.class);
            if (cached != null) return cached;
        }

        Optional<AuthenticatedPrincipal> loaded = principals.findById(principalId)
                .filter(Principal::isActive)
                .map(p -> new AuthenticatedPrincipal(
                        p.getId(),
                        p.getIdentifier(),
                        p.getDisplayName(),
                        p.isPlatformOperator(),
                        p.getTokenGeneration(),
                        rolesFor(p.getId())));

        if (cache != null) cache.put(principalId, loaded);
        return loaded;
    }

    @Transactional
    public Principal create(String identifier, String displayName, String secret, boolean platformOperator) {
        hashService.checkPolicy(secret);
        Principal principal = Principal.builder()
                .identifier(normalize(identifier))
                .displayName(displayName)
                .secretHash(hashService.hash(secret))
                .platformOperator(platformOperator)
                .build();
        return principals.save(principal);
    }

    @Transactional(readOnly = true)
    public boolean exists(String identifier) {
        String normalized = normalize(identifier);
        return normalized != null && principals.existsByIdentifier(normalized);
    }

    /**
     * Replaces the secret, invalidates every access token issued so far and revokes derived sessions.
     *
     * @return the new token generation
     */
    @Transactional
    public long rotateSecret(Long principalId, String newSecret) {
        hashService.checkPolicy(newSecret);
        Principal principal = principals.findById(principalId)
                .filter(Principal::isActive)
                .orElseThrow(() -> new InvalidCredentialsException("Cannot rotate secret of principal " + principalId));

        principal.setSecretHash(hashService.hash(newSecret));
        principal.setTokenGeneration(principal.getTokenGeneration() + 1);
        principals.save(principal);
        log.info("Secret rotated for principal {}", principalId);
        events.publishEvent(new PrincipalPrivilegesChangedEvent(principalId, PrivilegeChange.SECRET_ROTATED));
        return principal.getTokenGeneration();
    }

    @Transactional
    public void recordLogin(Long principalId) {
        principals.findById(principalId).ifPresent(p -> p.setLastLoginAt(clock.instant()));
    }

    /**
     * Invalidates all access tokens of the principal and publishes the change.
     *
     * @return the new generation
     */
    @Transactional
    public long bumpTokenGeneration(Long principalId, PrivilegeChange cause) {
        Principal principal = principals.findById(principalId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown principal " + principalId));
        principal.setTokenGeneration(principal.getTokenGeneration() + 1);
        principals.save(principal);
        events.publishEvent(new PrincipalPrivilegesChangedEvent(principalId, cause));
        return principal.getTokenGeneration();
    }

    @Transactional
    public void deactivate(Long principalId) {
        Principal principal = principals.findById(principalId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown principal " + principalId));
        if (!principal.isActive()) {
            return;
        }
        principal.setStatus(PrincipalStatus.DEACTIVATED);
        principal.setTokenGeneration(principal.getTokenGeneration() + 1);
        principals.save(principal);
        log.info("Principal {} deactivated", principalId);
        events.publishEvent(new PrincipalPrivilegesChangedEvent(principalId, PrivilegeChange.DEACTIVATED));
    }

    public void evict(Long principalId) {
        Cache cache = cacheManager.getCache(SNAPSHOT_CACHE);
        if (cache != null) cache.evict(principalId);
    }

    @Order(PrincipalPrivilegesChangedEvent.EVICT_SNAPSHOT_ORDER)
    @TransactionalEventListener(fallbackExecution = true)
    public void onPrivilegesChanged(PrincipalPrivilegesChangedEvent event) {
        evict(event.principalId());
    }

    public static String normalize(String identifier) {
        if (identifier == null) return null;
        String v = identifier.trim().toLowerCase(Locale.ROOT);
        return v.isEmpty() ? null : v;
    }
}
