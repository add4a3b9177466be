package io.github.drompincen.shopbench.runtime.llm;

import java.time.Duration;

public record HttpSettings(
        Duration connectTimeout,
        Duration requestTimeout
) {
    public static HttpSettings defaults() {
        return new HttpSettings(Duration.ofSeconds(30), Duration.ofSeconds(60));
    }
}
