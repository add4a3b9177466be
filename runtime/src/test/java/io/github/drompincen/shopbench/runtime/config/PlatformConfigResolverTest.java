package io.github.drompincen.shopbench.runtime.config;

import io.github.drompincen.shopbench.protocol.api.PlatformConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PlatformConfigResolverTest {

    private final PlatformConfigResolver resolver = new PlatformConfigResolver();

    @Test
    void resolveReadsPrefixedKeysCaseInsensitively() {
        Map<String, String> env = Map.of(
                "CLAUDE_BASE_URL", "https://api.anthropic.com/v1/messages",
                "CLAUDE_API_KEY", "\"sk-ant-123\"",
                "CLAUDE_MODEL", "'claude-test'");

        Optional<PlatformConfig> config = resolver.resolve("claude", env);

        assertThat(config).contains(new PlatformConfig(
                "https://api.anthropic.com/v1/messages", "sk-ant-123", "claude-test"));
    }

    @Test
    void resolveStripsBearerPrefix() {
        Map<String, String> env = Map.of(
                "PERPLEX_BASE_URL", "https://api.perplexity.ai/chat/completions",
                "PERPLEX_API_KEY", "Bearer pplx-1");

        assertThat(resolver.resolve("PERPLEX", env)).get()
                .extracting(PlatformConfig::apiKey).isEqualTo("pplx-1");
    }

    @Test
    void resolveIsEmptyWithoutApiKey() {
        assertThat(resolver.resolve("CHATGPT", Map.of("CHATGPT_BASE_URL", "https://x"))).isEmpty();
    }

    @Test
    void resolveRequiresBaseUrlExceptForGemini() {
        assertThat(resolver.resolve("COPILOT", Map.of("COPILOT_API_KEY", "k"))).isEmpty();
        assertThat(resolver.resolve("GEMINI", Map.of("GEMINI_API_KEY", "k", "GEMINI_MODEL", "gemini-pro")))
                .get()
                .satisfies(c -> {
                    assertThat(c.hasBaseUrl()).isFalse();
                    assertThat(c.model()).isEqualTo("gemini-pro");
                });
    }

    @Test
    void resolveIsEmptyForBlankPlatform() {
        assertThat(resolver.resolve(" ", Map.of())).isEmpty();
        assertThat(resolver.resolve(null, Map.of())).isEmpty();
    }
}
