package com.github.dimitryivaniuta.labelbridge.bridge;

import java.util.List;

/**
 * Body of {@code POST /api/sessions} on the annotation engine.
 */
public record EngineCredentialRequest(String subject, Long project, List<String> scope, long ttlSeconds) {}
