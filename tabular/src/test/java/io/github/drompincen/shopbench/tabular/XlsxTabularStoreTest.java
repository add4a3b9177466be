package io.github.drompincen.shopbench.tabular;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XlsxTabularStoreTest {

    private XlsxTabularStore store;

    @BeforeEach
    void setUp() {
        store = new XlsxTabularStore();
    }

    @Test
    void writeAndLoadPreservesColumnOrderAndUnicode(@TempDir Path tempDir) {
        Path path = tempDir.resolve("reports").resolve("out.xlsx");
        Map<String, String> row = new LinkedHashMap<>();
        row.put("scenario_id", "Q001");
        row.put("user_prompt", "Où acheter des chaussures ? 👟");
        row.put("model_response", "line1\nline2");

        store.write(path, List.of("scenario_id", "user_prompt", "model_response"), List.of(row));
        List<Map<String, String>> loaded = store.load(path);

        assertThat(loaded).hasSize(1);
        assertThat(loaded.get(0).keySet()).containsExactly("scenario_id", "user_prompt", "model_response");
        assertThat(loaded.get(0)).isEqualTo(row);
    }

    @Test
    void missingValuesAreWrittenBlank(@TempDir Path tempDir) {
        Path path = tempDir.resolve("blank.xlsx");

        store.write(path, List.of("a", "b"), List.of(Map.of("a", "1"), Map.of("a", "2", "b", "x")));
        List<Map<String, String>> loaded = store.load(path);

        assertThat(loaded).containsExactly(Map.of("a", "1", "b", ""), Map.of("a", "2", "b", "x"));
    }

    @Test
    void rewriteReplacesFileWithoutLeavingTempFiles(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("report.xlsx");

        store.write(path, List.of("a"), List.of(Map.of("a", "first")));
        store.write(path, List.of("a"), List.of(Map.of("a", "second"), Map.of("a", "third")));

        assertThat(store.load(path)).extracting(r -> r.get("a")).containsExactly("second", "third");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).containsExactly(path);
        }
    }

    @Test
    void loadReadsNumericCellsAsPlainText(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("numeric.xlsx");
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(path)) {
            Sheet sheet = workbook.createSheet("Tests");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("scenario_id");
            header.createCell(1).setCellValue("step_index");
            header.createCell(2).setCellValue("weight");
            Row data = sheet.createRow(1);
            data.createCell(0).setCellValue("Q001");
            data.createCell(1).setCellValue(2);
            data.createCell(2).setCellValue(1.5);
            sheet.createRow(2);
            workbook.write(out);
        }

        List<Map<String, String>> loaded = store.load(path);

        assertThat(loaded).hasSize(1);
        assertThat(loaded.get(0)).containsEntry("step_index", "2").containsEntry("weight", "1.5");
    }

    @Test
    void oversizedCellsAreTruncated(@TempDir Path tempDir) {
        Path path = tempDir.resolve("big.xlsx");
        String huge = "x".repeat(40_000);

        store.write(path, List.of("full_model_response"), List.of(Map.of("full_model_response", huge)));

        assertThat(store.load(path).get(0).get("full_model_response")).hasSize(32_767);
    }

    @Test
    void loadMissingFileFails(@TempDir Path tempDir) {
        assertThatThrownBy(() -> store.load(tempDir.resolve("nope.xlsx")))
                .isInstanceOf(TabularStoreException.class)
                .hasMessageContaining("Workbook not found");
    }
}
