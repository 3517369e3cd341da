package com.github.dimitryivaniuta.labelbridge.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for the gateway core. Everything here is supplied by the environment;
 * defaults match a single-node deployment.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "label-bridge")
public class LabelBridgeProperties {

    private RateLimit rateLimit = new RateLimit();
    private Token token = new Token();
    private Engine engine = new Engine();
    private Audit audit = new Audit();
    private Secrets secrets = new Secrets();

    @Getter
    @Setter
    public static class RateLimit {
        private boolean enabled = true;
        /** Admitted requests per key and window. */
        private int limit = 1000;
        private Duration window = Duration.ofHours(1);
        /** Separate budget for login attempts, keyed by IP only. */
        private int loginLimit = 10;
        private Duration loginWindow = Duration.ofMinutes(1);
        /** Upper bound of tracked keys; evicting one only resets its window. */
        private long maxTrackedKeys = 100_000;
    }

    @Getter
    @Setter
    public static class Token {
        /** HS256 signing secret, at least 32 bytes. */
        private String secret;
        private Duration ttl = Duration.ofHours(1);
        private String issuer = "label-bridge";
    }

    @Getter
    @Setter
    public static class Engine {
        private String baseUrl = "http://localhost:8080";
        /** Service token used for credential issuance and invalidation. */
        private String apiToken;
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(5);
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofMillis(200);
        /** Upper bound for a bridged session regardless of what the engine grants. */
        private Duration maxSessionTtl = Duration.ofMinutes(30);
        /** Subtracted from the engine's expiry so a cached credential is never used at the edge. */
        private Duration expirySkew = Duration.ofSeconds(30);
        /** How long a caller waits for another caller's in-flight acquisition. */
        private Duration acquireTimeout = Duration.ofSeconds(15);
    }

    @Getter
    @Setter
    public static class Audit {
        private int writerThreads = 2;
        private int queueCapacity = 10_000;
    }

    @Getter
    @Setter
    public static class Secrets {
        private String pepper = "";
        private int iterations = 120_000;
    }
}
