package io.github.drompincen.shopbench.runtime.report;

import io.github.drompincen.shopbench.protocol.api.ModelResponse;
import io.github.drompincen.shopbench.protocol.api.ReportFields;
import io.github.drompincen.shopbench.protocol.api.StepResult;
import io.github.drompincen.shopbench.protocol.api.TestStep;
import io.github.drompincen.shopbench.tabular.TabularStore;
import io.github.drompincen.shopbench.tabular.TabularStoreException;
import io.github.drompincen.shopbench.tabular.XlsxTabularStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.github.drompincen.shopbench.runtime.plan.TestSteps.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class ReportSinkTest {

    @TempDir
    Path tempDir;

    private final XlsxTabularStore store = new XlsxTabularStore();

    @Test
    void initializeWritesInputRowsBeforeAnyResult() {
        Path report = tempDir.resolve("report.xlsx");
        ReportSink sink = new ReportSink(store, report, List.of(step("Q1", "CHATGPT", "1", "1", "hi")));

        sink.initialize();

        List<Map<String, String>> rows = store.load(report);
        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row).containsEntry(ReportFields.USER_PROMPT, "hi");
            assertThat(row).doesNotContainKey(ReportFields.MODEL_RESPONSE);
        });
    }

    @Test
    void everyRecordRewritesTheReport() {
        TestStep a = step("Q1", "CHATGPT", "1", "1", "first");
        TestStep b = step("Q1", "CHATGPT", "2", "2", "second");
        Path report = tempDir.resolve("report.xlsx");
        ReportSink sink = new ReportSink(store, report, List.of(a, b));
        sink.initialize();

        sink.record(StepResult.of(a, new ModelResponse("raw-a", "text-a"), "", Map.of()));

        List<Map<String, String>> afterOne = store.load(report);
        assertThat(afterOne.get(0)).containsEntry(ReportFields.MODEL_RESPONSE, "text-a");
        assertThat(afterOne.get(1)).containsEntry(ReportFields.MODEL_RESPONSE, "");

        sink.record(StepResult.of(b, new ModelResponse("raw-b", "text-b"), "", Map.of()));

        assertThat(store.load(report)).extracting(r -> r.get(ReportFields.MODEL_RESPONSE))
                .containsExactly("text-a", "text-b");
        assertThat(sink.results()).hasSize(2);
    }

    @Test
    void rewritingSameResultsGivesSameContent() {
        TestStep a = step("Q1", "CHATGPT", "1", "1", "first");
        Path report = tempDir.resolve("report.xlsx");
        ReportSink sink = new ReportSink(store, report, List.of(a));
        sink.initialize();
        sink.record(StepResult.of(a, new ModelResponse("raw", "text"), "c", Map.of()));
        List<Map<String, String>> before = store.load(report);

        ReportTable again = ReportBuilder.build(List.of(a), sink.results());
        store.write(report, again.columns(), again.rows());

        assertThat(store.load(report)).isEqualTo(before);
    }

    @Test
    void concurrentRecordsAreAllPersisted() throws Exception {
        List<TestStep> steps = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            steps.add(step("Q1", i % 2 == 0 ? "CHATGPT" : "CLAUDE", "s" + i, String.valueOf(i), "p" + i));
        }
        Path report = tempDir.resolve("report.xlsx");
        ReportSink sink = new ReportSink(store, report, steps);
        sink.initialize();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        for (TestStep s : steps) {
            pool.submit(() -> {
                start.await();
                sink.record(StepResult.of(s, new ModelResponse("r", "t-" + s.stepId()), "", Map.of()));
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(60, TimeUnit.SECONDS)).isTrue();

        assertThat(sink.results()).hasSize(20);
        assertThat(store.load(report)).allSatisfy(row ->
                assertThat(row.get(ReportFields.MODEL_RESPONSE)).isEqualTo("t-" + row.get(ReportFields.STEP_ID)));
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(report);
        }
    }

    @Test
    void failedRewriteIsLoggedAndResultStillKept() {
        TabularStore failing = mock(TabularStore.class);
        ReportSink sink = new ReportSink(failing, tempDir.resolve("r.xlsx"), List.of());
        TestStep a = step("Q1", "CHATGPT", "1", "1", "first");
        doThrow(new TabularStoreException("disk full")).when(failing).write(any(), any(), any());

        sink.record(StepResult.of(a, ModelResponse.empty(), "", Map.of()));

        assertThat(sink.results()).hasSize(1);
    }

    @Test
    void failedInitializeIsFatal() {
        TabularStore failing = mock(TabularStore.class);
        doThrow(new TabularStoreException("read-only")).when(failing).write(any(), any(), any());
        ReportSink sink = new ReportSink(failing, tempDir.resolve("r.xlsx"), List.of());

        assertThatThrownBy(sink::initialize).isInstanceOf(ReportWriteException.class)
                .hasRootCauseMessage("read-only");
    }

    @Test
    void reportPathsUseUtcTimestamp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-04T05:06:07Z"), ZoneOffset.ofHours(9));

        Path path = new ReportPaths(tempDir.resolve("reports"), clock).next();

        assertThat(path.getFileName().toString()).isEqualTo("test_report_20260304_050607.xlsx");
        assertThat(Files.isDirectory(tempDir.resolve("reports"))).isTrue();
    }
}
