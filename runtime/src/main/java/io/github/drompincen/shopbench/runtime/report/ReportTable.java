package io.github.drompincen.shopbench.runtime.report;

import java.util.List;
import java.util.Map;

/** Report content ready to be written: ordered columns plus one map per row. */
public record ReportTable(List<String> columns, List<Map<String, String>> rows) {
    public ReportTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }
}
