package io.github.drompincen.shopbench.runtime.plan;

import io.github.drompincen.shopbench.protocol.api.TestStep;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Include/exclude filter on {@code platform_id}, compared case-insensitively.
 * An empty include set keeps every platform.
 */
public record PlatformFilter(Set<String> include, Set<String> exclude) {

    public PlatformFilter {
        include = normalize(include);
        exclude = normalize(exclude);
    }

    public static PlatformFilter none() {
        return new PlatformFilter(Set.of(), Set.of());
    }

    public boolean accepts(String platformId) {
        String id = platformId == null ? "" : platformId.strip().toUpperCase(Locale.ROOT);
        if (!include.isEmpty() && !include.contains(id)) return false;
        return !exclude.contains(id);
    }

    public List<TestStep> apply(List<TestStep> steps) {
        return steps.stream().filter(s -> accepts(s.platformId())).toList();
    }

    private static Set<String> normalize(Collection<String> ids) {
        if (ids == null) return Set.of();
        return ids.stream()
                .filter(id -> id != null && !id.isBlank())
                .map(id -> id.strip().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
