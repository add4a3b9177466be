package io.github.drompincen.shopbench.runtime.orchestrator;

import io.github.drompincen.shopbench.protocol.api.StepStatus;
import io.github.drompincen.shopbench.protocol.api.TestStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Slf4jStepObserver implements StepObserver {

    private static final Logger log = LoggerFactory.getLogger(Slf4jStepObserver.class);

    @Override
    public void onTransition(TestStep step, StepStatus from, StepStatus to) {
        if (to == StepStatus.EXECUTING) {
            log.info("[Step] Executing step scenario_id={} platform_id={} step_id={} step_index={}",
                    step.scenarioId(), step.platformId(), step.stepId(), step.stepIndex());
        } else {
            log.debug("[Step] scenario_id={} platform_id={} step_id={}: {} -> {}",
                    step.scenarioId(), step.platformId(), step.stepId(), from, to);
        }
    }

    @Override
    public void onFailure(TestStep step, Throwable error) {
        log.error("[Step] Unexpected error while executing step scenario_id={} platform_id={} step_id={} "
                        + "step_index={}: {}", step.scenarioId(), step.platformId(), step.stepId(),
                step.stepIndex(), error.getMessage(), error);
    }
}
