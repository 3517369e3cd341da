package com.github.dimitryivaniuta.labelbridge.support;

import com.github.dimitryivaniuta.labelbridge.config.LabelBridgeProperties;

import java.time.Duration;

/** Properties tuned for fast unit tests. */
public final class TestProperties {
    private TestProperties() {}

    public static final String TOKEN_SECRET = "unit-test-secret-unit-test-secret-0123456789";

    public static LabelBridgeProperties create() {
        LabelBridgeProperties p = new LabelBridgeProperties();
        p.getToken().setSecret(TOKEN_SECRET);
        p.getSecrets().setIterations(1000);
        p.getSecrets().setPepper("pepper");
        p.getEngine().setBackoff(Duration.ofMillis(10));
        p.getEngine().setAcquireTimeout(Duration.ofSeconds(5));
        return p;
    }
}
