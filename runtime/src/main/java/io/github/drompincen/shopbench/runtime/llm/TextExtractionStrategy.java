package io.github.drompincen.shopbench.runtime.llm;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Pulls text out of one known response shape. Returns empty when the shape
 * does not match or carries no text.
 */
@FunctionalInterface
public interface TextExtractionStrategy {

    Optional<String> extract(JsonNode root);
}
