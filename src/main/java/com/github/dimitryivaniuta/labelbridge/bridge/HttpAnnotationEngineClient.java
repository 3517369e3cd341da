package com.github.dimitryivaniuta.labelbridge.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.labelbridge.config.LabelBridgeProperties;
import com.github.dimitryivaniuta.labelbridge.metrics.LabelBridgeMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;
import java.util.function.Supplier;

/**
 * RestTemplate-backed engine client. Service calls authenticate with the configured API token,
 * task calls with the bridged session token.
 */
@Slf4j
@Component
public class HttpAnnotationEngineClient implements AnnotationEngineClient {

    private final RestTemplate restTemplate;
    private final LabelBridgeProperties.Engine props;
    private final LabelBridgeMetrics metrics;

    public HttpAnnotationEngineClient(@Qualifier("annotationEngineRestTemplate") RestTemplate restTemplate,
                                      LabelBridgeProperties props,
                                      LabelBridgeMetrics metrics) {
        this.restTemplate = restTemplate;
        this.props = props.getEngine();
        this.metrics = metrics;
    }

    @Override
    public EngineCredential issue(EngineCredentialRequest request) {
        URI uri = uri("/api/sessions");
        EngineCredential credential = call("issue", () -> {
            ResponseEntity<EngineCredential> resp = restTemplate.exchange(
                    uri, HttpMethod.POST, new HttpEntity<>(request, serviceHeaders()), EngineCredential.class);
            return resp.getBody();
        });
        if (credential == null || !credential.isComplete()) {
            metrics.engineFailure("bad_response");
            throw new BridgeUnavailableException("Engine returned an incomplete credential");
        }
        return credential;
    }

    @Override
    public void invalidate(String credentialId) {
        URI uri = uri("/api/sessions/" + credentialId);
        call("invalidate", () -> restTemplate.exchange(
                uri, HttpMethod.DELETE, new HttpEntity<>(serviceHeaders()), Void.class));
    }

    @Override
    public JsonNode listTasks(Long engineProjectId, String sessionToken) {
        URI uri = uri("/api/projects/" + engineProjectId + "/tasks");
        return call("list_tasks", () -> restTemplate.exchange(
                uri, HttpMethod.GET, new HttpEntity<>(sessionHeaders(sessionToken)), JsonNode.class).getBody());
    }

    @Override
    public int importTasks(Long engineProjectId, String sessionToken, JsonNode tasks) {
        URI uri = uri("/api/projects/" + engineProjectId + "/import");
        JsonNode body = call("import_tasks", () -> restTemplate.exchange(
                uri, HttpMethod.POST, new HttpEntity<>(tasks, sessionHeaders(sessionToken)), JsonNode.class).getBody());
        if (body != null && body.hasNonNull("task_count")) {
            return body.get("task_count").asInt();
        }
        return tasks != null && tasks.isArray() ? tasks.size() : 0;
    }

    private <T> T call(String operation, Supplier<T> exchange) {
        long start = System.nanoTime();
        try {
            return exchange.get();
        } catch (HttpStatusCodeException ex) {
            throw translate(operation, ex);
        } catch (ResourceAccessException ex) {
            metrics.engineFailure("io");
            log.warn("Engine {} failed: {}", operation, ex.getMessage());
            throw new BridgeUnavailableException("Annotation engine unreachable", ex);
        } catch (RestClientException ex) {
            metrics.engineFailure("bad_response");
            log.warn("Engine {} returned an unreadable response: {}", operation, ex.getMessage());
            throw new BridgeUnavailableException("Annotation engine returned an unreadable response", ex);
        } finally {
            metrics.recordDuration("label_bridge_engine_call_seconds", operation, System.nanoTime() - start);
        }
    }

    private BridgeException translate(String operation, HttpStatusCodeException ex) {
        int status = ex.getStatusCode().value();
        log.warn("Engine {} failed: status={} body={}", operation, status, trim(ex.getResponseBodyAsString(), 256));
        if (ex.getStatusCode().is5xxServerError() || status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            metrics.engineFailure("status_" + status);
            return new BridgeUnavailableException("Annotation engine returned " + status, ex);
        }
        metrics.engineFailure("refused");
        return new BridgeUnauthorizedException("Annotation engine refused the request with " + status, status);
    }

    private HttpHeaders serviceHeaders() {
        HttpHeaders headers = jsonHeaders();
        if (StringUtils.hasText(props.getApiToken())) {
            headers.set(HttpHeaders.AUTHORIZATION, "Token " + props.getApiToken());
        }
        return headers;
    }

    private HttpHeaders sessionHeaders(String sessionToken) {
        HttpHeaders headers = jsonHeaders();
        headers.setBearerAuth(sessionToken);
        return headers;
    }

    private static HttpHeaders jsonHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    private URI uri(String path) {
        String base = props.getBaseUrl();
        if (!StringUtils.hasText(base)) base = "http://localhost:8080";
        return URI.create(base.replaceAll("/+$", "") + path);
    }

    private static String trim(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
