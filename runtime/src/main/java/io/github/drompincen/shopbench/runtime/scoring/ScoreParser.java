package io.github.drompincen.shopbench.runtime.scoring;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the judge's answer into flat string values. The whole text is tried
 * as JSON first, then the span from the first {@code {} to the last
 * {@code }}. Anything that is not a JSON object yields an empty map.
 */
@Component
public class ScoreParser {

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public ScoreParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public Map<String, String> parse(String text) {
        if (text == null || text.isBlank()) return Map.of();
        JsonNode root = tryParse(text);
        if (root == null) {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start < 0 || end <= start) return Map.of();
            root = tryParse(text.substring(start, end + 1));
        }
        if (root == null || !root.isObject()) return Map.of();

        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), render(field.getValue()));
        }
        return values;
    }

    private JsonNode tryParse(String candidate) {
        try {
            return strictReader.readTree(candidate);
        } catch (Exception e) {
            return null;
        }
    }

    String render(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return "";
        if (node.isContainerNode()) {
            try {
                return objectMapper.writeValueAsString(node);
            } catch (Exception e) {
                return node.toString();
            }
        }
        return node.asText();
    }
}
