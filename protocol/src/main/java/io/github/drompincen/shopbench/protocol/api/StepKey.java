package io.github.drompincen.shopbench.protocol.api;

import java.util.Map;

/**
 * Identity of a step row, used to match a result back to its input row.
 */
public record StepKey(
        String runId,
        String scenarioId,
        String platformId,
        String stepId,
        String stepIndex,
        String stepType
) {
    public static StepKey fromRow(Map<String, String> row) {
        return new StepKey(
                row.getOrDefault(ReportFields.RUN_ID, ""),
                row.getOrDefault(ReportFields.SCENARIO_ID, ""),
                row.getOrDefault(ReportFields.PLATFORM_ID, ""),
                row.getOrDefault(ReportFields.STEP_ID, ""),
                row.getOrDefault(ReportFields.STEP_INDEX, ""),
                row.getOrDefault(ReportFields.STEP_TYPE, ""));
    }

    /** Pipe-joined label used as the {@code scenario} column when a report has no input rows. */
    public String toLabel() {
        return String.join("|", runId, scenarioId, platformId, stepId, stepIndex, stepType);
    }
}
