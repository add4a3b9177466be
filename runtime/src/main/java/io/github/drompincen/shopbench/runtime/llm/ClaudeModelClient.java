package io.github.drompincen.shopbench.runtime.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.shopbench.protocol.api.PlatformConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.Map;
import java.util.Set;

/**
 * Anthropic messages API. Authenticates with {@code x-api-key} rather than a
 * bearer token.
 */
@Component
public class ClaudeModelClient extends HttpModelClient {

    public static final String PLATFORM_ID = "CLAUDE";

    private final int maxTokens;
    private final String apiVersion;

    public ClaudeModelClient(HttpClient httpClient, ObjectMapper objectMapper,
                             ResponseTextExtractor textExtractor, HttpSettings httpSettings,
                             @Value("${shopbench.claude.max-tokens:1024}") int maxTokens,
                             @Value("${shopbench.claude.api-version:2023-06-01}") String apiVersion) {
        super(httpClient, objectMapper, textExtractor, httpSettings);
        this.maxTokens = maxTokens;
        this.apiVersion = apiVersion;
    }

    @Override
    public Set<String> platformIds() {
        return Set.of(PLATFORM_ID);
    }

    @Override
    public String send(String prompt, PlatformConfig config) {
        requireConfig(PLATFORM_ID, config);
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.model());
        body.put("max_tokens", maxTokens);
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", prompt);
        return postJson(PLATFORM_ID, config.baseUrl(), body, Map.of(
                "x-api-key", config.apiKey(),
                "anthropic-version", apiVersion));
    }
}
