package com.github.dimitryivaniuta.labelbridge.auth;

import java.time.Instant;

public record IssuedToken(String token, Instant expiresAt) {}
