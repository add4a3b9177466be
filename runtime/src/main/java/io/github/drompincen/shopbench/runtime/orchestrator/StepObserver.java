package io.github.drompincen.shopbench.runtime.orchestrator;

import io.github.drompincen.shopbench.protocol.api.StepStatus;
import io.github.drompincen.shopbench.protocol.api.TestStep;

/**
 * Receives step lifecycle transitions from platform tasks. Called from
 * several threads at once.
 */
public interface StepObserver {

    void onTransition(TestStep step, StepStatus from, StepStatus to);

    void onFailure(TestStep step, Throwable error);

    StepObserver NONE = new StepObserver() {
        @Override
        public void onTransition(TestStep step, StepStatus from, StepStatus to) {
        }

        @Override
        public void onFailure(TestStep step, Throwable error) {
        }
    };
}
