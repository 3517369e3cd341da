package com.github.dimitryivaniuta.labelbridge.bridge;

import com.github.dimitryivaniuta.labelbridge.credential.CredentialStore;
import com.github.dimitryivaniuta.labelbridge.credential.PrincipalPrivilegesChangedEvent;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.event.TransactionalApplicationListenerMethodAdapter;

import java.lang.reflect.Method;

import static org.assertj.core.api.Assertions.assertThat;

class PrivilegeChangeListenerOrderTest {

    private static int listenerOrder(Class<?> type) throws NoSuchMethodException {
        Method method = type.getMethod("onPrivilegesChanged", PrincipalPrivilegesChangedEvent.class);
        return new TransactionalApplicationListenerMethodAdapter(type.getSimpleName(), type, method).getOrder();
    }

    @Test
    void snapshotIsEvictedBeforeSessionsAreRevoked() throws Exception {
        int evict = listenerOrder(CredentialStore.class);
        int revoke = listenerOrder(SessionBridge.class);

        assertThat(evict).isEqualTo(PrincipalPrivilegesChangedEvent.EVICT_SNAPSHOT_ORDER);
        assertThat(revoke).isEqualTo(PrincipalPrivilegesChangedEvent.REVOKE_SESSIONS_ORDER);
        assertThat(evict).isLessThan(revoke);
    }
}
