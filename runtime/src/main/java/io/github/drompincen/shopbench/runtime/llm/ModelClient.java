package io.github.drompincen.shopbench.runtime.llm;

import io.github.drompincen.shopbench.protocol.api.ModelResponse;
import io.github.drompincen.shopbench.protocol.api.PlatformConfig;

import java.util.Set;

/**
 * One AI platform under test. Implementations are stateless and safe to call
 * from several platform tasks at once.
 */
public interface ModelClient {

    /** Upper-case platform identifiers this client serves. */
    Set<String> platformIds();

    /** Sends the prompt and returns the raw response payload. */
    String send(String prompt, PlatformConfig config);

    /** Best-effort plain text from a raw payload of this client. */
    String extractText(String raw);

    default ModelResponse call(String prompt, PlatformConfig config) {
        String raw = send(prompt, config);
        return new ModelResponse(raw, extractText(raw));
    }
}
