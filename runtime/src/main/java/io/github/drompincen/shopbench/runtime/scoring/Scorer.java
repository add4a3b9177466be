package io.github.drompincen.shopbench.runtime.scoring;

import io.github.drompincen.shopbench.protocol.api.ReportFields;
import io.github.drompincen.shopbench.protocol.api.TestStep;
import io.github.drompincen.shopbench.runtime.llm.ModelClient;
import io.github.drompincen.shopbench.runtime.llm.ModelClientRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Asks the judge platform to score a step response. Scoring never throws;
 * failures come back as {@link ScoreOutcome#error()}.
 */
@Service
public class Scorer {

    private static final Logger log = LoggerFactory.getLogger(Scorer.class);

    static final String PROMPT_MISSING = "Scoring prompt missing.";

    private final ModelClientRegistry registry;
    private final ScoreParser parser;

    public Scorer(ModelClientRegistry registry, ScoreParser parser) {
        this.registry = registry;
        this.parser = parser;
    }

    public ScoreOutcome score(ScoringContext context, TestStep step, String responseText) {
        if (context == null || !context.enabled()) return ScoreOutcome.disabled();
        if (context.template().isBlank()) return ScoreOutcome.blank(PROMPT_MISSING);
        if (responseText == null || responseText.isEmpty()) return ScoreOutcome.blank("");

        try {
            String prompt = context.template().render(Map.of(
                    "step_type", step.stepType(),
                    "user_prompt", step.userPrompt(),
                    "model_response", responseText,
                    "ground_truth", context.groundTruthFor(step.skuId())));
            ModelClient judge = registry.require(context.platformId());
            String judgeText = judge.call(prompt, context.config()).text();
            Map<String, String> parsed = parser.parse(judgeText);

            Map<String, String> values = new LinkedHashMap<>();
            for (String field : ReportFields.SCORING_FIELDS) {
                String v = parsed.get(field);
                values.put(field, v != null ? v : "");
            }
            log.debug("[Scoring] scenario_id={} platform_id={} step_id={} scored by {}",
                    step.scenarioId(), step.platformId(), step.stepId(), context.platformId());
            return new ScoreOutcome(values, parsed.getOrDefault(ReportFields.COMMENTS, ""), "");
        } catch (Exception e) {
            log.error("[Scoring] Unexpected error while scoring step scenario_id={} platform_id={} step_id={} "
                            + "step_index={}: {}: {}", step.scenarioId(), step.platformId(), step.stepId(),
                    step.stepIndex(), e.getClass().getSimpleName(), e.getMessage());
            return ScoreOutcome.blank("Scoring error: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /** Joins two comment fragments with {@code " | "}, dropping empty ones. */
    public static String joinComments(String comment, String extra) {
        if (comment == null || comment.isEmpty()) return extra != null ? extra : "";
        if (extra == null || extra.isEmpty()) return comment;
        return comment + " | " + extra;
    }
}
