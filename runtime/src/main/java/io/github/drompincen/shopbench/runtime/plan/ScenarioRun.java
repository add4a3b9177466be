package io.github.drompincen.shopbench.runtime.plan;

import io.github.drompincen.shopbench.protocol.api.TestStep;

import java.util.List;

/** One scenario's ordered steps as seen by a single platform. */
public record ScenarioRun(String scenarioId, List<TestStep> steps) {
    public ScenarioRun {
        steps = List.copyOf(steps);
    }
}
