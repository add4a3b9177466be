package io.github.drompincen.shopbench.runtime.report;

import io.github.drompincen.shopbench.protocol.api.StepResult;
import io.github.drompincen.shopbench.protocol.api.TestStep;
import io.github.drompincen.shopbench.tabular.TabularStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared result list and report file of one run. Every {@link #record} appends
 * and rewrites the whole report while holding the lock, so the workbook on
 * disk always reflects a prefix of the results.
 */
public class ReportSink {

    private static final Logger log = LoggerFactory.getLogger(ReportSink.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<StepResult> results = new ArrayList<>();
    private final TabularStore store;
    private final Path reportPath;
    private final List<TestStep> inputRows;

    public ReportSink(TabularStore store, Path reportPath, List<TestStep> inputRows) {
        this.store = store;
        this.reportPath = reportPath;
        this.inputRows = List.copyOf(inputRows);
    }

    /**
     * Writes the report before any step has run.
     *
     * @throws ReportWriteException if the report cannot be created
     */
    public void initialize() {
        lock.lock();
        try {
            write();
            log.info("[Report] Initialized report at {} with {} input rows", reportPath, inputRows.size());
        } catch (RuntimeException e) {
            throw new ReportWriteException("Failed to initialize report " + reportPath, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends the result and rewrites the report. A failed rewrite is logged;
     * the previous report stays on disk and the next record retries the write.
     */
    public void record(StepResult result) {
        lock.lock();
        try {
            results.add(result);
            try {
                write();
                log.info("[Report] Updated report after step scenario_id={} platform_id={} step_id={} step_index={}",
                        result.scenarioId(), result.platformId(), result.stepId(), result.stepIndex());
            } catch (RuntimeException e) {
                log.error("[Report] Failed to rewrite {} after step scenario_id={} platform_id={} step_id={}: {}",
                        reportPath, result.scenarioId(), result.platformId(), result.stepId(), e.getMessage(), e);
            }
        } finally {
            lock.unlock();
        }
    }

    public List<StepResult> results() {
        lock.lock();
        try {
            return List.copyOf(results);
        } finally {
            lock.unlock();
        }
    }

    public Path reportPath() {
        return reportPath;
    }

    private void write() {
        ReportTable table = ReportBuilder.build(inputRows, results);
        store.write(reportPath, table.columns(), table.rows());
    }
}
