package io.github.drompincen.shopbench.runtime.orchestrator;

import io.github.drompincen.shopbench.protocol.api.ModelResponse;
import io.github.drompincen.shopbench.protocol.api.PlatformConfig;
import io.github.drompincen.shopbench.protocol.api.StepResult;
import io.github.drompincen.shopbench.protocol.api.StepStatus;
import io.github.drompincen.shopbench.protocol.api.TestStep;
import io.github.drompincen.shopbench.runtime.exec.ConversationHistory;
import io.github.drompincen.shopbench.runtime.exec.RetriesExhaustedException;
import io.github.drompincen.shopbench.runtime.exec.StepExecutor;
import io.github.drompincen.shopbench.runtime.plan.ScenarioRun;
import io.github.drompincen.shopbench.runtime.report.ReportSink;
import io.github.drompincen.shopbench.runtime.scoring.ScoreOutcome;
import io.github.drompincen.shopbench.runtime.scoring.Scorer;
import io.github.drompincen.shopbench.runtime.scoring.ScoringContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Runs every scenario of one platform in order. Each scenario starts with an
 * empty conversation; every step is recorded whether it succeeded or not.
 */
class PlatformTask implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PlatformTask.class);

    static final String UNEXPECTED_ERROR = "Unexpected error: ";

    private final String platformId;
    private final List<ScenarioRun> runs;
    private final PlatformConfig config;
    private final StepExecutor executor;
    private final Scorer scorer;
    private final ScoringContext scoringContext;
    private final ReportSink sink;
    private final StepObserver observer;

    PlatformTask(String platformId, List<ScenarioRun> runs, PlatformConfig config, StepExecutor executor,
                 Scorer scorer, ScoringContext scoringContext, ReportSink sink, StepObserver observer) {
        this.platformId = platformId;
        this.runs = runs;
        this.config = config;
        this.executor = executor;
        this.scorer = scorer;
        this.scoringContext = scoringContext;
        this.sink = sink;
        this.observer = observer;
    }

    @Override
    public void run() {
        if (config == null) {
            log.warn("[Platform] No config for platform_id={}; every step will be recorded as failed", platformId);
        }
        for (ScenarioRun run : runs) {
            log.info("[Platform] Running scenario_id={} platform_id={} steps={}",
                    run.scenarioId(), platformId, run.steps().size());
            ConversationHistory history = new ConversationHistory();
            for (TestStep step : run.steps()) {
                runStep(step, history);
            }
        }
    }

    private void runStep(TestStep step, ConversationHistory history) {
        observer.onTransition(step, null, StepStatus.PENDING);
        observer.onTransition(step, StepStatus.PENDING, StepStatus.EXECUTING);

        ModelResponse response = ModelResponse.empty();
        String comments = "";
        Map<String, String> scores = Map.of();
        StepStatus status;
        try {
            response = executor.execute(step, history, config);
            observer.onTransition(step, StepStatus.EXECUTING, StepStatus.SUCCEEDED);
            observer.onTransition(step, StepStatus.SUCCEEDED, StepStatus.SCORING);
            ScoreOutcome outcome = scorer.score(scoringContext, step, response.text());
            scores = outcome.values();
            comments = Scorer.joinComments(outcome.comment(), outcome.error());
            observer.onTransition(step, StepStatus.SCORING, StepStatus.SCORED);
            status = StepStatus.SCORED;
        } catch (RuntimeException e) {
            response = ModelResponse.empty();
            comments = failureComment(e);
            observer.onTransition(step, StepStatus.EXECUTING, StepStatus.FAILED);
            observer.onFailure(step, e);
            status = StepStatus.FAILED;
        }

        history.append(step.userPrompt(), response.text());
        sink.record(StepResult.of(step, response, comments, scores));
        observer.onTransition(step, status, StepStatus.RECORDED);
    }

    static String failureComment(Throwable error) {
        Throwable root = error;
        if (error instanceof RetriesExhaustedException && error.getCause() != null) {
            root = error.getCause();
        }
        return UNEXPECTED_ERROR + root.getClass().getSimpleName() + ": " + root.getMessage();
    }
}
