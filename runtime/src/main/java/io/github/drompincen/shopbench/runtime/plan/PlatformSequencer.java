package io.github.drompincen.shopbench.runtime.plan;

import io.github.drompincen.shopbench.protocol.api.TestStep;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Turns a grouping into one work-stream per platform: the platform's
 * scenarios in sorted scenario order, each with its ordered steps.
 */
@Component
public class PlatformSequencer {

    public SortedMap<String, List<ScenarioRun>> sequence(ScenarioGrouping grouping) {
        SortedMap<String, List<ScenarioRun>> plan = new TreeMap<>();
        grouping.scenarios().forEach((scenarioId, platforms) -> {
            for (var entry : platforms.entrySet()) {
                List<TestStep> steps = entry.getValue();
                plan.computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
                        .add(new ScenarioRun(scenarioId, steps));
            }
        });
        plan.replaceAll((platformId, runs) -> Collections.unmodifiableList(runs));
        return Collections.unmodifiableSortedMap(plan);
    }
}
