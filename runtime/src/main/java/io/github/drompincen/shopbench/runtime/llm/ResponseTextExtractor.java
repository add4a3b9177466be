package io.github.drompincen.shopbench.runtime.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Best-effort text extraction across the response shapes of the supported
 * platforms. Strategies run in order; the first non-empty text wins and the
 * raw payload is the final fallback.
 */
@Component
public class ResponseTextExtractor {

    private final ObjectMapper objectMapper;
    private final List<TextExtractionStrategy> strategies;

    public ResponseTextExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strategies = List.of(
                ResponseTextExtractor::outputText,
                ResponseTextExtractor::responsesOutputMessages,
                ResponseTextExtractor::firstChoiceMessage,
                ResponseTextExtractor::contentParts,
                ResponseTextExtractor::geminiCandidates);
    }

    public String extract(String raw) {
        if (raw == null || raw.isEmpty()) return "";
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (Exception e) {
            return raw;
        }
        if (root == null || !root.isObject()) return raw;

        for (TextExtractionStrategy strategy : strategies) {
            Optional<String> text = strategy.extract(root);
            if (text.isPresent()) return text.get();
        }
        return raw;
    }

    // {"output_text": "..."}
    static Optional<String> outputText(JsonNode root) {
        return nonEmpty(root.path("output_text").asText(""));
    }

    // {"output": [{"type": "message", "content": [{"text": "..."}]}]}
    static Optional<String> responsesOutputMessages(JsonNode root) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode item : root.path("output")) {
            if (!"message".equals(item.path("type").asText())) continue;
            for (JsonNode content : item.path("content")) {
                sb.append(content.path("text").asText(""));
            }
        }
        return nonEmpty(sb.toString());
    }

    // {"choices": [{"message": {"content": "..."}}]}
    static Optional<String> firstChoiceMessage(JsonNode root) {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? nonEmpty(content.asText()) : Optional.empty();
    }

    // {"content": [{"type": "text", "text": "..."}]}
    static Optional<String> contentParts(JsonNode root) {
        JsonNode content = root.path("content");
        if (!content.isArray()) return Optional.empty();
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : content) {
            if (part.isObject()) sb.append(part.path("text").asText(""));
        }
        return nonEmpty(sb.toString());
    }

    // {"candidates": [{"content": {"parts": [{"text": "..."}]}}]}
    static Optional<String> geminiCandidates(JsonNode root) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode candidate : root.path("candidates")) {
            for (JsonNode part : candidate.path("content").path("parts")) {
                sb.append(part.path("text").asText(""));
            }
        }
        return nonEmpty(sb.toString());
    }

    private static Optional<String> nonEmpty(String text) {
        return text == null || text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
