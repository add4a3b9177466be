package io.github.drompincen.shopbench.runtime.plan;

import io.github.drompincen.shopbench.protocol.api.TestStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * {@code scenario_id -> platform_id -> ordered steps}. Scenario and platform
 * ids iterate in sorted order.
 */
public final class ScenarioGrouping {

    private final SortedMap<String, SortedMap<String, List<TestStep>>> scenarios;

    ScenarioGrouping(SortedMap<String, SortedMap<String, List<TestStep>>> scenarios) {
        SortedMap<String, SortedMap<String, List<TestStep>>> copy = new TreeMap<>();
        scenarios.forEach((scenarioId, platforms) -> {
            SortedMap<String, List<TestStep>> platformCopy = new TreeMap<>();
            platforms.forEach((platformId, steps) -> platformCopy.put(platformId, List.copyOf(steps)));
            copy.put(scenarioId, Collections.unmodifiableSortedMap(platformCopy));
        });
        this.scenarios = Collections.unmodifiableSortedMap(copy);
    }

    public static ScenarioGrouping empty() {
        return new ScenarioGrouping(new TreeMap<>());
    }

    public SortedMap<String, SortedMap<String, List<TestStep>>> scenarios() {
        return scenarios;
    }

    public List<String> scenarioIds() {
        return List.copyOf(scenarios.keySet());
    }

    public List<TestStep> steps(String scenarioId, String platformId) {
        Map<String, List<TestStep>> platforms = scenarios.get(scenarioId);
        if (platforms == null) return List.of();
        return platforms.getOrDefault(platformId, List.of());
    }

    public boolean isEmpty() {
        return scenarios.isEmpty();
    }

    /** Surviving rows in scenario, platform, step order. */
    public List<TestStep> flatten() {
        List<TestStep> rows = new ArrayList<>();
        scenarios.values().forEach(platforms -> platforms.values().forEach(rows::addAll));
        return rows;
    }

    public int stepCount() {
        return scenarios.values().stream()
                .flatMap(p -> p.values().stream())
                .mapToInt(List::size)
                .sum();
    }
}
