package io.github.drompincen.shopbench.runtime.orchestrator;

import io.github.drompincen.shopbench.protocol.api.StepResult;

import java.nio.file.Path;
import java.util.List;

public record RunSummary(Path reportPath, List<StepResult> results, int platformCount) {

    public RunSummary {
        results = List.copyOf(results);
    }

    public long failedSteps() {
        return results.stream()
                .filter(r -> r.comments().startsWith(PlatformTask.UNEXPECTED_ERROR))
                .count();
    }
}
