package com.github.dimitryivaniuta.labelbridge.auth;

import com.github.dimitryivaniuta.labelbridge.config.LabelBridgeProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies HS256 access tokens. A token carries the principal's token generation in
 * the {@code gen} claim; the gateway rejects tokens whose generation is no longer current.
 */
@Service
public class AccessTokenService {

    private static final Logger log = LoggerFactory.getLogger(AccessTokenService.class);
    private static final String GENERATION_CLAIM = "gen";
    private static final int MIN_SECRET_BYTES = 32;

    private final byte[] secret;
    private final Duration ttl;
    private final String issuer;
    private final Clock clock;

    public AccessTokenService(LabelBridgeProperties props, Clock clock) {
        LabelBridgeProperties.Token cfg = props.getToken();
        String configured = cfg.getSecret();
        if (configured == null || configured.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("label-bridge.token.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.secret = configured.getBytes(StandardCharsets.UTF_8);
        this.ttl = cfg.getTtl();
        this.issuer = cfg.getIssuer();
        this.clock = clock;
    }

    public IssuedToken issue(Long principalId, long generation) {
        try {
            Instant now = clock.instant();
            Instant expiresAt = now.plus(ttl);
            JWTClaimsSet claims = new JWTClaimsSet.Builder()
                    .jwtID(UUID.randomUUID().toString())
                    .issuer(issuer)
                    .subject(principalId.toString())
                    .claim(GENERATION_CLAIM, generation)
                    .issueTime(Date.from(now))
                    .expirationTime(Date.from(expiresAt))
                    .build();

            SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
            JWSSigner signer = new MACSigner(secret);
            jwt.sign(signer);
            return new IssuedToken(jwt.serialize(), expiresAt);
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign access token", e);
        }
    }

    /**
     * Full verification: signature, issuer, expiry.
     *
     * @throws InvalidTokenException if any check fails
     */
    public TokenClaims verify(String token) {
        JWTClaimsSet claims = verifiedClaims(token);
        Instant exp = claims.getExpirationTime() == null ? null : claims.getExpirationTime().toInstant();
        if (exp == null || !exp.isAfter(clock.instant())) {
            throw new InvalidTokenException("Access token has expired");
        }
        if (issuer != null && !issuer.equals(claims.getIssuer())) {
            throw new InvalidTokenException("Unexpected token issuer");
        }
        return toClaims(claims, exp);
    }

    /**
     * Principal id from a token whose signature is valid, ignoring expiry. Used only to pick the
     * rate-limit key, never to authenticate.
     */
    public Long signedSubject(String token) {
        try {
            return toClaims(verifiedClaims(token), null).principalId();
        } catch (InvalidTokenException ex) {
            return null;
        }
    }

    private JWTClaimsSet verifiedClaims(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Missing access token");
        }
        try {
            SignedJWT jwt = SignedJWT.parse(token);
            JWSVerifier verifier = new MACVerifier(secret);
            if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm()) || !jwt.verify(verifier)) {
                throw new InvalidTokenException("Invalid access token signature");
            }
            return jwt.getJWTClaimsSet();
        } catch (ParseException | JOSEException e) {
            log.debug("Rejected malformed access token: {}", e.getMessage());
            throw new InvalidTokenException("Invalid access token");
        }
    }

    private static TokenClaims toClaims(JWTClaimsSet claims, Instant exp) {
        try {
            Long principalId = Long.valueOf(claims.getSubject());
            Long generation = claims.getLongClaim(GENERATION_CLAIM);
            if (generation == null) {
                throw new InvalidTokenException("Access token has no generation");
            }
            return new TokenClaims(principalId, generation, claims.getJWTID(), exp);
        } catch (ParseException | NumberFormatException e) {
            throw new InvalidTokenException("Invalid access token claims");
        }
    }
}
