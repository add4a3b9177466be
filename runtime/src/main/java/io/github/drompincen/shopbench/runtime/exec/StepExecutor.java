package io.github.drompincen.shopbench.runtime.exec;

import io.github.drompincen.shopbench.protocol.api.ModelResponse;
import io.github.drompincen.shopbench.protocol.api.PlatformConfig;
import io.github.drompincen.shopbench.protocol.api.TestStep;
import io.github.drompincen.shopbench.runtime.config.PreconditionException;
import io.github.drompincen.shopbench.runtime.llm.ModelClient;
import io.github.drompincen.shopbench.runtime.llm.ModelClientRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Runs one step against its platform: transcript prompt, bounded retries with
 * linear backoff, then the platform's throttle pause.
 */
@Service
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final ModelClientRegistry registry;
    private final RetryPolicy retryPolicy;
    private final ThrottlePolicy throttlePolicy;
    private final Sleeper sleeper;

    public StepExecutor(ModelClientRegistry registry, RetryPolicy retryPolicy,
                        ThrottlePolicy throttlePolicy, Sleeper sleeper) {
        this.registry = registry;
        this.retryPolicy = retryPolicy;
        this.throttlePolicy = throttlePolicy;
        this.sleeper = sleeper;
    }

    /**
     * @throws PreconditionException when the config is missing or the platform
     *         is unknown; these are not retried
     * @throws RetriesExhaustedException when every attempt failed
     */
    public ModelResponse execute(TestStep step, ConversationHistory history, PlatformConfig config) {
        String platformId = step.platformId();
        if (config == null) {
            throw new PreconditionException("Missing config for platform_id=" + platformId);
        }
        ModelClient client = registry.require(platformId);
        String prompt = history.buildPrompt(step.userPrompt());

        int total = retryPolicy.totalAttempts();
        RuntimeException last = null;
        for (int attempt = 1; attempt <= total; attempt++) {
            ModelResponse response;
            try {
                response = client.call(prompt, config);
            } catch (PreconditionException e) {
                throw e;
            } catch (RuntimeException e) {
                last = e;
                if (attempt < total) {
                    Duration delay = retryPolicy.delayAfter(attempt);
                    log.warn("[Executor] Model call failed; retrying attempt={}/{} scenario_id={} platform_id={} "
                                    + "step_id={} step_index={} in {}s: {}: {}",
                            attempt, total, step.scenarioId(), platformId, step.stepId(), step.stepIndex(),
                            delay.toSeconds(), e.getClass().getSimpleName(), e.getMessage());
                    pause(delay);
                }
                continue;
            }
            if (attempt > 1) {
                log.info("[Executor] platform_id={} step_id={} succeeded on attempt {}/{}",
                        platformId, step.stepId(), attempt, total);
            }
            return throttled(platformId, response);
        }
        throw new RetriesExhaustedException("Model call failed after " + total + " attempts for platform_id="
                + platformId + " step_id=" + step.stepId(), total, last);
    }

    private ModelResponse throttled(String platformId, ModelResponse response) {
        Duration delay = throttlePolicy.delayFor(platformId);
        if (!delay.isZero() && !delay.isNegative()) {
            log.debug("[Executor] Throttling platform_id={} for {}ms", platformId, delay.toMillis());
            pause(delay);
        }
        return response;
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting " + delay.toMillis() + "ms", e);
        }
    }
}
