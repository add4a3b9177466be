package io.github.drompincen.shopbench.protocol.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one executed step. {@code scores} is empty when scoring did not
 * run for the step; otherwise it holds every field of
 * {@link ReportFields#SCORING_FIELDS}, blank where the judge gave no value.
 */
public record StepResult(
        String scenarioId,
        String platformId,
        String stepId,
        String stepIndex,
        String stepType,
        String runId,
        String userPrompt,
        String modelResponse,
        String fullModelResponse,
        String textModelResponse,
        String comments,
        Map<String, String> scores
) {
    public StepResult {
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores != null ? scores : Map.of()));
    }

    public static StepResult of(TestStep step, ModelResponse response, String comments, Map<String, String> scores) {
        ModelResponse r = response != null ? response : ModelResponse.empty();
        String text = r.text() != null ? r.text() : "";
        return new StepResult(
                step.scenarioId(), step.platformId(), step.stepId(), step.stepIndex(),
                step.stepType(), step.runId(), step.userPrompt(),
                text, r.raw() != null ? r.raw() : "", text,
                comments != null ? comments : "",
                scores);
    }

    public StepKey key() {
        return new StepKey(runId, scenarioId, platformId, stepId, stepIndex, stepType);
    }

    /**
     * Output columns this result carries, in report order. Scoring columns are
     * only present when scoring ran.
     */
    public Map<String, String> outputValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(ReportFields.MODEL_RESPONSE, modelResponse);
        values.put(ReportFields.FULL_MODEL_RESPONSE, fullModelResponse);
        values.put(ReportFields.TEXT_MODEL_RESPONSE, textModelResponse);
        values.put(ReportFields.COMMENTS, comments);
        for (String field : ReportFields.SCORING_FIELDS) {
            if (scores.containsKey(field)) {
                values.put(field, scores.get(field));
            }
        }
        return values;
    }
}
