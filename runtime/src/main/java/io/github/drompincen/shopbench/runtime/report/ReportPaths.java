package io.github.drompincen.shopbench.runtime.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** {@code <dir>/test_report_<yyyyMMdd_HHmmss UTC>.xlsx}. */
public class ReportPaths {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Path reportsDir;
    private final Clock clock;

    public ReportPaths(Path reportsDir, Clock clock) {
        this.reportsDir = reportsDir;
        this.clock = clock;
    }

    public Path next() {
        try {
            Files.createDirectories(reportsDir);
        } catch (IOException e) {
            throw new ReportWriteException("Cannot create reports directory " + reportsDir, e);
        }
        return reportsDir.resolve("test_report_" + TIMESTAMP.format(clock.instant()) + ".xlsx");
    }

    public Path reportsDir() {
        return reportsDir;
    }
}
