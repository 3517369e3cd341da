package com.github.dimitryivaniuta.labelbridge.bridge;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outbound contract with the annotation engine. Implementations throw
 * {@link BridgeUnavailableException} for transient failures and {@link BridgeUnauthorizedException}
 * for refusals; nothing else escapes.
 */
public interface AnnotationEngineClient {

    EngineCredential issue(EngineCredentialRequest request);

    void invalidate(String credentialId);

    JsonNode listTasks(Long engineProjectId, String sessionToken);

    /**
     * @return number of tasks the engine reports as imported
     */
    int importTasks(Long engineProjectId, String sessionToken, JsonNode tasks);
}
