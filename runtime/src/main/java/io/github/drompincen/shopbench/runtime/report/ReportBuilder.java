package io.github.drompincen.shopbench.runtime.report;

import io.github.drompincen.shopbench.protocol.api.ReportFields;
import io.github.drompincen.shopbench.protocol.api.StepKey;
import io.github.drompincen.shopbench.protocol.api.StepResult;
import io.github.drompincen.shopbench.protocol.api.TestStep;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges step results into the input rows.
 *
 * <p>With input rows, the report keeps the first row's columns and appends
 * any output field some result carries. Results are matched to rows by
 * {@link StepKey}; the latest result for a key wins. Without input rows each
 * result becomes its own row labelled by its pipe-joined key.
 */
public final class ReportBuilder {

    private ReportBuilder() {}

    public static ReportTable build(List<TestStep> inputRows, List<StepResult> results) {
        List<String> columns = columns(inputRows, results);
        if (inputRows.isEmpty()) {
            List<Map<String, String>> rows = new ArrayList<>();
            for (StepResult result : results) {
                rows.add(resultRow(result));
            }
            return new ReportTable(columns, rows);
        }

        Map<StepKey, StepResult> byKey = new HashMap<>();
        for (StepResult result : results) {
            byKey.put(result.key(), result);
        }
        List<Map<String, String>> rows = new ArrayList<>(inputRows.size());
        for (TestStep input : inputRows) {
            Map<String, String> row = new LinkedHashMap<>(input.columns());
            StepResult result = byKey.get(StepKey.fromRow(input.columns()));
            if (result != null) {
                Map<String, String> outputs = result.outputValues();
                for (String field : ReportFields.OUTPUT_FIELDS) {
                    if (row.containsKey(field) || outputs.containsKey(field)) {
                        row.put(field, outputs.getOrDefault(field, ""));
                    }
                }
            }
            rows.add(row);
        }
        return new ReportTable(columns, rows);
    }

    static List<String> columns(List<TestStep> inputRows, List<StepResult> results) {
        List<String> columns = new ArrayList<>();
        if (!inputRows.isEmpty()) {
            columns.addAll(inputRows.get(0).columns().keySet());
        } else if (!results.isEmpty()) {
            columns.add(ReportFields.SCENARIO);
            columns.add(ReportFields.USER_PROMPT);
            columns.addAll(ReportFields.OUTPUT_FIELDS);
        } else {
            return columns;
        }
        for (String field : ReportFields.OUTPUT_FIELDS) {
            if (columns.contains(field)) continue;
            if (results.stream().anyMatch(r -> r.outputValues().containsKey(field))) {
                columns.add(field);
            }
        }
        return columns;
    }

    private static Map<String, String> resultRow(StepResult result) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(ReportFields.SCENARIO, result.key().toLabel());
        row.put(ReportFields.USER_PROMPT, result.userPrompt());
        Map<String, String> outputs = result.outputValues();
        for (String field : ReportFields.OUTPUT_FIELDS) {
            row.put(field, outputs.getOrDefault(field, ""));
        }
        return row;
    }
}
