package io.github.drompincen.shopbench.protocol.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * One row of a test workbook. The well-known columns are lifted into fields;
 * {@code columns} keeps every column of the source row in its original order
 * so the report can echo columns the harness does not interpret.
 */
public record TestStep(
        String scenarioId,
        String platformId,
        String stepId,
        String stepIndex,
        String stepType,
        String userPrompt,
        String skuId,
        String runId,
        Map<String, String> columns
) {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    public TestStep {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns != null ? columns : Map.of()));
    }

    public static TestStep fromRow(Map<String, String> row) {
        return new TestStep(
                value(row, ReportFields.SCENARIO_ID),
                value(row, ReportFields.PLATFORM_ID),
                value(row, ReportFields.STEP_ID),
                value(row, ReportFields.STEP_INDEX),
                value(row, ReportFields.STEP_TYPE),
                value(row, ReportFields.USER_PROMPT),
                value(row, ReportFields.SKU_ID),
                value(row, ReportFields.RUN_ID),
                row);
    }

    public StepKey key() {
        return new StepKey(runId, scenarioId, platformId, stepId, stepIndex, stepType);
    }

    /**
     * Numeric step ordinal. Only plain decimal literals count; anything else,
     * including Java suffixes and hex floats, sorts as 0.0.
     */
    public double numericIndex() {
        if (stepIndex == null || stepIndex.isBlank()) return 0.0;
        String text = stepIndex.strip();
        if (!DECIMAL.matcher(text).matches()) return 0.0;
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static String value(Map<String, String> row, String column) {
        String v = row.get(column);
        return v != null ? v : "";
    }
}
