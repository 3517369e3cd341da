package com.github.dimitryivaniuta.labelbridge.web;

public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    public static final String CLIENT_IP_MDC_KEY = "clientIp";
    public static final String PRINCIPAL_MDC_KEY = "principalId";

    /** Request attribute holding the {@code AuthenticatedPrincipal} set by {@link GatewayFilter}. */
    public static final String PRINCIPAL_ATTRIBUTE = "labelBridge.principal";
}
