package com.github.dimitryivaniuta.labelbridge.credential;

import org.springframework.core.Ordered;

/**
 * Published whenever what a principal may do shrinks or its credentials change. Listeners drop
 * anything derived from the old privileges (cached snapshots, bridged engine sessions).
 *
 * <p>The snapshot is evicted before sessions are revoked: a caller that reaches the bridge after the
 * revoke must already resolve the new roles.
 */
public record PrincipalPrivilegesChangedEvent(Long principalId, PrivilegeChange cause) {

    public static final int EVICT_SNAPSHOT_ORDER = Ordered.HIGHEST_PRECEDENCE;
    public static final int REVOKE_SESSIONS_ORDER = Ordered.HIGHEST_PRECEDENCE + 10;
}
