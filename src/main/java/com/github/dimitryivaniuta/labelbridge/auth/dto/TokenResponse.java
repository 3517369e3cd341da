package com.github.dimitryivaniuta.labelbridge.auth.dto;

import java.time.Instant;

public record TokenResponse(String token, Instant expiresAt, PrincipalView principal) {}
