package io.github.drompincen.shopbench.runtime.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.shopbench.protocol.api.PlatformConfig;
import io.github.drompincen.shopbench.runtime.config.PreconditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Gemini {@code generateContent}. The request is issued asynchronously and
 * awaited with the configured request timeout.
 */
@Component
public class GeminiModelClient extends HttpModelClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiModelClient.class);

    public static final String PLATFORM_ID = "GEMINI";
    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";
    static final String API_KEY_REJECTED = "API keys are not supported by this API";

    public GeminiModelClient(HttpClient httpClient, ObjectMapper objectMapper,
                             ResponseTextExtractor textExtractor, HttpSettings httpSettings) {
        super(httpClient, objectMapper, textExtractor, httpSettings);
    }

    @Override
    public Set<String> platformIds() {
        return Set.of(PLATFORM_ID);
    }

    @Override
    public String send(String prompt, PlatformConfig config) {
        requireConfig(PLATFORM_ID, config);
        if (!config.hasModel()) {
            throw new PreconditionException("GEMINI_MODEL is not set");
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("contents").addObject()
                .putArray("parts").addObject()
                .put("text", prompt);

        HttpRequest request = buildRequest(endpoint(config), body, Map.of("x-goog-api-key", config.apiKey()));
        CompletableFuture<HttpResponse<String>> future =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> response;
        try {
            response = future.get(httpSettings.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ModelCallException(PLATFORM_ID + " request timed out after "
                    + httpSettings.requestTimeout().toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ModelCallException(PLATFORM_ID + " request failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ModelCallException(PLATFORM_ID + " request interrupted", e);
        }

        String responseBody = response.body();
        if (response.statusCode() >= 400 && responseBody != null && responseBody.contains(API_KEY_REJECTED)) {
            log.warn("[Gemini] Endpoint {} rejected API key authentication", endpoint(config));
            throw new ModelCallException("Gemini rejected API key authentication. "
                    + "Use a Generative Language API key from AI Studio, or point GEMINI_BASE_URL "
                    + "at an endpoint that accepts API keys.", response.statusCode(), responseBody);
        }
        return checkStatus(PLATFORM_ID, response.statusCode(), responseBody);
    }

    String endpoint(PlatformConfig config) {
        String base = config.hasBaseUrl() ? config.baseUrl() : DEFAULT_BASE_URL;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/models/" + config.model() + ":generateContent";
    }
}
