package io.github.drompincen.shopbench.runtime.scoring;

import io.github.drompincen.shopbench.protocol.api.ReportFields;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores for one step. {@code values} is empty when scoring is disabled and
 * otherwise holds every scoring field. {@code comment} is the judge's own
 * remark; {@code error} describes a scoring failure.
 */
public record ScoreOutcome(Map<String, String> values, String comment, String error) {

    public ScoreOutcome {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values != null ? values : Map.of()));
        comment = comment != null ? comment : "";
        error = error != null ? error : "";
    }

    public static ScoreOutcome disabled() {
        return new ScoreOutcome(Map.of(), "", "");
    }

    public static ScoreOutcome blank(String error) {
        return new ScoreOutcome(blankFields(), "", error);
    }

    public boolean hasError() {
        return !error.isEmpty();
    }

    static Map<String, String> blankFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        ReportFields.SCORING_FIELDS.forEach(f -> fields.put(f, ""));
        return fields;
    }
}
