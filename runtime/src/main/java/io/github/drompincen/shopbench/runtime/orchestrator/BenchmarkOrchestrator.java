package io.github.drompincen.shopbench.runtime.orchestrator;

import io.github.drompincen.shopbench.protocol.api.PlatformConfig;
import io.github.drompincen.shopbench.protocol.api.TestStep;
import io.github.drompincen.shopbench.runtime.config.PlatformConfigResolver;
import io.github.drompincen.shopbench.runtime.config.PreconditionException;
import io.github.drompincen.shopbench.runtime.exec.StepExecutor;
import io.github.drompincen.shopbench.runtime.plan.PlatformSequencer;
import io.github.drompincen.shopbench.runtime.plan.ScenarioGrouper;
import io.github.drompincen.shopbench.runtime.plan.ScenarioGrouping;
import io.github.drompincen.shopbench.runtime.plan.ScenarioRun;
import io.github.drompincen.shopbench.runtime.report.ReportPaths;
import io.github.drompincen.shopbench.runtime.report.ReportSink;
import io.github.drompincen.shopbench.runtime.scoring.Scorer;
import io.github.drompincen.shopbench.runtime.scoring.ScoringContext;
import io.github.drompincen.shopbench.runtime.scoring.ScoringSetup;
import io.github.drompincen.shopbench.tabular.TabularStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a benchmark run: loads and groups the test rows, writes the initial
 * report, then runs one task per platform on a fixed pool and waits for all of
 * them.
 */
@Service
public class BenchmarkOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkOrchestrator.class);

    private final TabularStore tabularStore;
    private final ScenarioGrouper grouper;
    private final PlatformSequencer sequencer;
    private final PlatformConfigResolver configResolver;
    private final StepExecutor executor;
    private final Scorer scorer;
    private final ScoringSetup scoringSetup;
    private final ReportPaths reportPaths;
    private final StepObserver observer;

    public BenchmarkOrchestrator(TabularStore tabularStore, ScenarioGrouper grouper, PlatformSequencer sequencer,
                                 PlatformConfigResolver configResolver, StepExecutor executor, Scorer scorer,
                                 ScoringSetup scoringSetup, ReportPaths reportPaths, StepObserver observer) {
        this.tabularStore = tabularStore;
        this.grouper = grouper;
        this.sequencer = sequencer;
        this.configResolver = configResolver;
        this.executor = executor;
        this.scorer = scorer;
        this.scoringSetup = scoringSetup;
        this.reportPaths = reportPaths;
        this.observer = observer;
    }

    /**
     * @throws PreconditionException if the tests workbook is missing
     */
    public RunSummary run(RunRequest request) {
        Path testsPath = request.testsPath();
        if (testsPath == null || !Files.isRegularFile(testsPath)) {
            throw new PreconditionException("Tests workbook not found: " + testsPath);
        }
        log.info("[Run] Loading test rows from {}", testsPath);

        ScoringContext scoring = scoringSetup.prepare(request.scoringPlatformId(), request.env(),
                request.scoringPromptPath(), request.groundTruthPath());

        List<TestStep> steps = tabularStore.load(testsPath).stream().map(TestStep::fromRow).toList();
        List<TestStep> filtered = request.platformFilter().apply(steps);
        if (filtered.size() != steps.size()) {
            log.info("[Run] Platform filter {} kept {} of {} rows", request.platformFilter(),
                    filtered.size(), steps.size());
        }
        ScenarioGrouping grouping = grouper.group(filtered, request.scenarioStart(), request.scenarioEnd());
        List<TestStep> inputRows = grouping.flatten();
        log.info("[Run] Loaded {} rows across {} scenarios", inputRows.size(), grouping.scenarios().size());

        ReportSink sink = new ReportSink(tabularStore, reportPaths.next(), inputRows);
        sink.initialize();

        SortedMap<String, List<ScenarioRun>> plan = sequencer.sequence(grouping);
        Map<String, PlatformTask> tasks = new LinkedHashMap<>();
        plan.forEach((platformId, runs) -> {
            PlatformConfig config = configResolver.resolve(platformId, request.env()).orElse(null);
            tasks.put(platformId, new PlatformTask(platformId, runs, config, executor, scorer, scoring, sink, observer));
        });

        runAll(tasks);
        log.info("[Run] Wrote report {} for {} steps", sink.reportPath(), sink.results().size());
        return new RunSummary(sink.reportPath(), sink.results(), tasks.size());
    }

    private void runAll(Map<String, PlatformTask> tasks) {
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, tasks.size()), r -> {
            Thread t = new Thread(r, "platform-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            Map<String, Future<?>> futures = new LinkedHashMap<>();
            tasks.forEach((platformId, task) -> futures.put(platformId, pool.submit(task)));
            for (Map.Entry<String, Future<?>> entry : futures.entrySet()) {
                try {
                    entry.getValue().get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("[Run] Unexpected error while running platform platform_id={}: {}: {}",
                            entry.getKey(), cause.getClass().getSimpleName(), cause.getMessage(), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[Run] Interrupted while waiting for platform_id={}", entry.getKey());
                    break;
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
