package io.github.drompincen.shopbench.runtime.orchestrator;

import io.github.drompincen.shopbench.runtime.plan.PlatformFilter;

import java.nio.file.Path;
import java.util.Map;

/**
 * Inputs of one benchmark run. Scoring paths and the scoring platform may be
 * null, which disables scoring.
 */
public record RunRequest(
        Path testsPath,
        Map<String, String> env,
        PlatformFilter platformFilter,
        String scenarioStart,
        String scenarioEnd,
        String scoringPlatformId,
        Path scoringPromptPath,
        Path groundTruthPath
) {
    public RunRequest {
        env = env != null ? Map.copyOf(env) : Map.of();
        platformFilter = platformFilter != null ? platformFilter : PlatformFilter.none();
    }
}
