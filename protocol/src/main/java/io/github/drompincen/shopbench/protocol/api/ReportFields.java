package io.github.drompincen.shopbench.protocol.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Column names shared by test workbooks, step results and the report.
 */
public final class ReportFields {

    public static final String SCENARIO = "scenario";
    public static final String SCENARIO_ID = "scenario_id";
    public static final String PLATFORM_ID = "platform_id";
    public static final String STEP_ID = "step_id";
    public static final String STEP_INDEX = "step_index";
    public static final String STEP_TYPE = "step_type";
    public static final String USER_PROMPT = "user_prompt";
    public static final String SKU_ID = "sku_id";
    public static final String RUN_ID = "run_id";

    public static final String MODEL_RESPONSE = "model_response";
    public static final String FULL_MODEL_RESPONSE = "full_model_response";
    public static final String TEXT_MODEL_RESPONSE = "text_model_response";
    public static final String COMMENTS = "comments";

    public static final List<String> SCORING_FIELDS = List.of(
            "identity_accuracy_score",
            "attribute_completeness_score",
            "attribute_correctness_score",
            "regulatory_correctness_score",
            "transactional_reliability_score",
            "step_outcome",
            "failure_modes",
            "instant_checkout_feasibility_score",
            "checkout_failure_modes",
            "efficiency_score",
            "query_to_product_match_score",
            "agent_failure_modes");

    public static final List<String> RESPONSE_FIELDS = List.of(
            MODEL_RESPONSE, FULL_MODEL_RESPONSE, TEXT_MODEL_RESPONSE, COMMENTS);

    /** Response fields followed by the scoring fields, in report order. */
    public static final List<String> OUTPUT_FIELDS;

    static {
        List<String> output = new ArrayList<>(RESPONSE_FIELDS);
        output.addAll(SCORING_FIELDS);
        OUTPUT_FIELDS = Collections.unmodifiableList(output);
    }

    private ReportFields() {}
}
