package io.github.drompincen.shopbench.runtime.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.shopbench.protocol.api.PlatformConfig;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.Map;
import java.util.Set;

/**
 * Chat-completions style platforms that accept
 * {@code {"model": ..., "messages": [{"role": "user", "content": prompt}]}}
 * with bearer auth.
 */
@Component
public class ChatCompletionsModelClient extends HttpModelClient {

    public static final Set<String> PLATFORM_IDS = Set.of("PERPLEX", "COPILOT");

    public ChatCompletionsModelClient(HttpClient httpClient, ObjectMapper objectMapper,
                                      ResponseTextExtractor textExtractor, HttpSettings httpSettings) {
        super(httpClient, objectMapper, textExtractor, httpSettings);
    }

    @Override
    public Set<String> platformIds() {
        return PLATFORM_IDS;
    }

    @Override
    public String send(String prompt, PlatformConfig config) {
        requireConfig("chat-completions", config);
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.model());
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", prompt);
        return postJson("chat-completions", config.baseUrl(), body,
                Map.of("Authorization", bearer(config.apiKey())));
    }
}
