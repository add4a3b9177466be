package io.github.drompincen.shopbench.runtime.report;

import io.github.drompincen.shopbench.protocol.api.ModelResponse;
import io.github.drompincen.shopbench.protocol.api.ReportFields;
import io.github.drompincen.shopbench.protocol.api.StepResult;
import io.github.drompincen.shopbench.protocol.api.TestStep;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.github.drompincen.shopbench.runtime.plan.TestSteps.step;
import static org.assertj.core.api.Assertions.assertThat;

class ReportBuilderTest {

    private final TestStep first = step("Q1", "CHATGPT", "1", "1", "hello");
    private final TestStep second = step("Q1", "CHATGPT", "2", "2", "again");

    @Test
    void emptyRunProducesHeaderFromInputRows() {
        ReportTable table = ReportBuilder.build(List.of(first, second), List.of());

        assertThat(table.columns()).containsExactlyElementsOf(first.columns().keySet());
        assertThat(table.rows()).hasSize(2);
        assertThat(table.rows().get(0)).doesNotContainKey(ReportFields.MODEL_RESPONSE);
    }

    @Test
    void resultsFillMatchingRowsAndAppendResponseColumns() {
        StepResult result = StepResult.of(first, new ModelResponse("{raw}", "text"), "note", Map.of());

        ReportTable table = ReportBuilder.build(List.of(first, second), List.of(result));

        assertThat(table.columns()).endsWith(ReportFields.RESPONSE_FIELDS.toArray(String[]::new));
        assertThat(table.columns()).doesNotContain(ReportFields.SCORING_FIELDS.get(0));
        assertThat(table.rows().get(0))
                .containsEntry(ReportFields.MODEL_RESPONSE, "text")
                .containsEntry(ReportFields.FULL_MODEL_RESPONSE, "{raw}")
                .containsEntry(ReportFields.COMMENTS, "note")
                .containsEntry(ReportFields.USER_PROMPT, "hello");
        assertThat(table.rows().get(1)).doesNotContainKey(ReportFields.MODEL_RESPONSE);
    }

    @Test
    void scoringColumnsAppearOnceAnyResultIsScored() {
        Map<String, String> scores = new LinkedHashMap<>();
        ReportFields.SCORING_FIELDS.forEach(f -> scores.put(f, ""));
        scores.put("efficiency_score", "4");
        StepResult scored = StepResult.of(first, new ModelResponse("r", "t"), "", scores);

        ReportTable table = ReportBuilder.build(List.of(first), List.of(scored));

        assertThat(table.columns()).containsSubsequence(ReportFields.OUTPUT_FIELDS);
        assertThat(table.rows().get(0)).containsEntry("efficiency_score", "4");
    }

    @Test
    void existingOutputColumnsAreOverwrittenForMatchedRows() {
        Map<String, String> columns = new LinkedHashMap<>(first.columns());
        columns.put(ReportFields.COMMENTS, "stale comment");
        columns.put("identity_accuracy_score", "9");
        TestStep withOutputs = TestStep.fromRow(columns);
        StepResult result = StepResult.of(withOutputs, new ModelResponse("r", "t"), "fresh", Map.of());

        ReportTable table = ReportBuilder.build(List.of(withOutputs), List.of(result));

        assertThat(table.rows().get(0))
                .containsEntry(ReportFields.COMMENTS, "fresh")
                .containsEntry("identity_accuracy_score", "");
    }

    @Test
    void latestResultWinsForDuplicateKeys() {
        StepResult older = StepResult.of(first, new ModelResponse("old", "old"), "", Map.of());
        StepResult newer = StepResult.of(first, new ModelResponse("new", "new"), "", Map.of());

        ReportTable table = ReportBuilder.build(List.of(first), List.of(older, newer));

        assertThat(table.rows().get(0)).containsEntry(ReportFields.MODEL_RESPONSE, "new");
    }

    @Test
    void withoutInputRowsEachResultIsLabelledByItsKey() {
        StepResult result = StepResult.of(first, new ModelResponse("raw", "text"), "", Map.of());

        ReportTable table = ReportBuilder.build(List.of(), List.of(result));

        List<String> expected = new ArrayList<>(List.of(ReportFields.SCENARIO, ReportFields.USER_PROMPT));
        expected.addAll(ReportFields.OUTPUT_FIELDS);
        assertThat(table.columns()).containsExactlyElementsOf(expected);
        assertThat(table.rows()).singleElement().satisfies(row -> {
            assertThat(row).containsEntry(ReportFields.SCENARIO, "R1|Q1|CHATGPT|1|1|search");
            assertThat(row).containsEntry(ReportFields.USER_PROMPT, "hello");
            assertThat(row).containsEntry("agent_failure_modes", "");
        });
    }

    @Test
    void nothingAtAllProducesEmptyTable() {
        ReportTable table = ReportBuilder.build(List.of(), List.of());

        assertThat(table.columns()).isEmpty();
        assertThat(table.rows()).isEmpty();
    }
}
