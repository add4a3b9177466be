package io.github.drompincen.shopbench.runtime.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.shopbench.protocol.api.PlatformConfig;
import io.github.drompincen.shopbench.runtime.config.PreconditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Map;

/**
 * Base for clients that POST a JSON body to a platform's REST endpoint and
 * return the response body verbatim.
 */
public abstract class HttpModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(HttpModelClient.class);
    private static final int ERROR_PREVIEW_CHARS = 500;

    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final ResponseTextExtractor textExtractor;
    protected final HttpSettings httpSettings;

    protected HttpModelClient(HttpClient httpClient, ObjectMapper objectMapper,
                              ResponseTextExtractor textExtractor, HttpSettings httpSettings) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.textExtractor = textExtractor;
        this.httpSettings = httpSettings;
    }

    @Override
    public String extractText(String raw) {
        return textExtractor.extract(raw);
    }

    protected void requireConfig(String platformId, PlatformConfig config) {
        if (config == null) {
            throw new PreconditionException("Missing config for platform_id=" + platformId);
        }
    }

    protected HttpRequest buildRequest(String url, ObjectNode body, Map<String, String> headers) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ModelCallException("Failed to serialize request body", e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(httpSettings.requestTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json));
        headers.forEach(builder::header);
        return builder.build();
    }

    protected String postJson(String platformId, String url, ObjectNode body, Map<String, String> headers) {
        HttpRequest request = buildRequest(url, body, headers);
        log.debug("[{}] POST {}", platformId, url);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ModelCallException(platformId + " request timed out after "
                    + httpSettings.requestTimeout().toSeconds() + "s", e);
        } catch (IOException e) {
            throw new ModelCallException(platformId + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelCallException(platformId + " request interrupted", e);
        }
        return checkStatus(platformId, response.statusCode(), response.body());
    }

    protected String checkStatus(String platformId, int status, String body) {
        if (status < 200 || status >= 300) {
            String preview = body == null ? "" : body.substring(0, Math.min(ERROR_PREVIEW_CHARS, body.length()));
            throw new ModelCallException(platformId + " returned HTTP " + status + ": " + preview, status, body);
        }
        return body != null ? body : "";
    }

    protected static String bearer(String apiKey) {
        return "Bearer " + apiKey;
    }
}
