package io.github.drompincen.shopbench.protocol.api;

/**
 * A model call outcome: the raw payload as returned by the platform and the
 * best-effort plain text pulled out of it.
 */
public record ModelResponse(
        String raw,
        String text
) {
    public static ModelResponse empty() {
        return new ModelResponse("", "");
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }
}
