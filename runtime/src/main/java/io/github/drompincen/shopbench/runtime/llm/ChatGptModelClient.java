package io.github.drompincen.shopbench.runtime.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.shopbench.protocol.api.PlatformConfig;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.Map;
import java.util.Set;

/**
 * OpenAI responses API: {@code {"model": ..., "input": prompt}}.
 */
@Component
public class ChatGptModelClient extends HttpModelClient {

    public static final String PLATFORM_ID = "CHATGPT";

    public ChatGptModelClient(HttpClient httpClient, ObjectMapper objectMapper,
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
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.model());
        body.put("input", prompt);
        return postJson(PLATFORM_ID, config.baseUrl(), body,
                Map.of("Authorization", bearer(config.apiKey())));
    }
}
