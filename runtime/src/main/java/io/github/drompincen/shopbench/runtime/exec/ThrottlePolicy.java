package io.github.drompincen.shopbench.runtime.exec;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/** Pause applied after every successful call to a platform. */
public record ThrottlePolicy(Map<String, Duration> delays) {

    public ThrottlePolicy {
        delays = delays == null ? Map.of() : delays.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        e -> e.getKey().strip().toUpperCase(Locale.ROOT),
                        Map.Entry::getValue));
    }

    public static ThrottlePolicy defaults() {
        return new ThrottlePolicy(Map.of("CLAUDE", Duration.ofSeconds(10)));
    }

    public static ThrottlePolicy none() {
        return new ThrottlePolicy(Map.of());
    }

    public Duration delayFor(String platformId) {
        if (platformId == null) return Duration.ZERO;
        return delays.getOrDefault(platformId.strip().toUpperCase(Locale.ROOT), Duration.ZERO);
    }
}
