package io.github.drompincen.shopbench.tabular;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Row-oriented spreadsheet access. Rows are string-keyed by the header row;
 * column order is preserved in both directions.
 */
public interface TabularStore {

    List<Map<String, String>> load(Path path);

    void write(Path path, List<String> columns, List<Map<String, String>> rows);
}
