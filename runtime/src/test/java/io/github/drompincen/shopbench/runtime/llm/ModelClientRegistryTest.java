package io.github.drompincen.shopbench.runtime.llm;

import io.github.drompincen.shopbench.runtime.config.PreconditionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelClientRegistryTest {

    @Test
    void registersEveryPlatformIdOfAClient() {
        StubModelClient chat = new StubModelClient("PERPLEX", "COPILOT");
        StubModelClient claude = new StubModelClient("CLAUDE");

        ModelClientRegistry registry = new ModelClientRegistry(List.of(chat, claude));

        assertThat(registry.platformIds()).containsExactly("CLAUDE", "COPILOT", "PERPLEX");
        assertThat(registry.get("copilot")).containsSame(chat);
        assertThat(registry.require(" claude ")).isSameAs(claude);
    }

    @Test
    void requireRejectsUnknownPlatform() {
        ModelClientRegistry registry = new ModelClientRegistry(List.of());

        assertThatThrownBy(() -> registry.require("MYSTERY"))
                .isInstanceOf(PreconditionException.class)
                .hasMessage("Unknown platform_id=MYSTERY");
        assertThat(registry.get(null)).isEmpty();
    }
}
