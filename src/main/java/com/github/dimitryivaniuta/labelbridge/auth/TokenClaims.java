package com.github.dimitryivaniuta.labelbridge.auth;

import java.time.Instant;

/** Claims extracted from a verified access token. */
public record TokenClaims(Long principalId, long generation, String tokenId, Instant expiresAt) {}
