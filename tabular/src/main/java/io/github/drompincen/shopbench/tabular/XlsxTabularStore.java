package io.github.drompincen.shopbench.tabular;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;

/**
 * {@link TabularStore} over the first sheet of an .xlsx workbook. Every cell
 * is written as a string; writes replace the target atomically so readers
 * never observe a half-written workbook.
 */
@Component
public class XlsxTabularStore implements TabularStore {

    private static final Logger log = LoggerFactory.getLogger(XlsxTabularStore.class);

    public static final String SHEET_NAME = "Report";
    private static final int MAX_CELL_TEXT = SpreadsheetVersion.EXCEL2007.getMaxTextLength();

    @Override
    public List<Map<String, String>> load(Path path) {
        try (InputStream in = Files.newInputStream(path);
             Workbook workbook = WorkbookFactory.create(in)) {

            if (workbook.getNumberOfSheets() == 0) {
                throw new TabularStoreException("No worksheets found in " + path);
            }
            Sheet sheet = workbook.getSheetAt(0);

            List<String> header = null;
            List<Map<String, String>> rows = new ArrayList<>();
            for (Row row : sheet) {
                if (header == null) {
                    header = readHeader(row);
                    continue;
                }
                Map<String, String> values = new LinkedHashMap<>();
                boolean blank = true;
                for (int c = 0; c < header.size(); c++) {
                    String name = header.get(c);
                    if (name.isEmpty()) continue;
                    String value = getCellValue(row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
                    if (!value.isEmpty()) blank = false;
                    values.put(name, value);
                }
                if (!blank) rows.add(values);
            }
            log.debug("Loaded {} rows from {}", rows.size(), path);
            return rows;
        } catch (NoSuchFileException e) {
            throw new TabularStoreException("Workbook not found: " + path, e);
        } catch (IOException e) {
            throw new TabularStoreException("Failed to read workbook " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void write(Path path, List<String> columns, List<Map<String, String>> rows) {
        Path target = path.toAbsolutePath();
        Path dir = target.getParent();
        Path tmp = null;
        try {
            if (dir != null) Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");

            try (Workbook workbook = new XSSFWorkbook();
                 OutputStream out = Files.newOutputStream(tmp)) {
                Sheet sheet = workbook.createSheet(SHEET_NAME);
                writeRow(sheet.createRow(0), columns);
                int rowIdx = 1;
                for (Map<String, String> data : rows) {
                    List<String> values = new ArrayList<>(columns.size());
                    for (String column : columns) {
                        String v = data.get(column);
                        values.add(v != null ? v : "");
                    }
                    writeRow(sheet.createRow(rowIdx++), values);
                }
                workbook.write(out);
            }
            moveIntoPlace(tmp, target);
            tmp = null;
        } catch (IOException e) {
            throw new TabularStoreException("Failed to write workbook " + target + ": " + e.getMessage(), e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not remove temp workbook {}: {}", tmp, e.getMessage());
                }
            }
        }
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void writeRow(Row row, List<String> values) {
        int cellIdx = 0;
        for (String value : values) {
            Cell cell = row.createCell(cellIdx++);
            cell.setCellValue(fitCell(value));
        }
    }

    private String fitCell(String value) {
        if (value.length() <= MAX_CELL_TEXT) return value;
        log.warn("Truncating cell value of {} chars to {}", value.length(), MAX_CELL_TEXT);
        return value.substring(0, MAX_CELL_TEXT);
    }

    private List<String> readHeader(Row row) {
        List<String> header = new ArrayList<>();
        for (int c = 0; c < row.getLastCellNum(); c++) {
            header.add(getCellValue(row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL)).trim());
        }
        return header;
    }

    private String getCellValue(Cell cell) {
        if (cell == null) return "";
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        return switch (type) {
            case STRING -> cell.getStringCellValue();
            case NUMERIC -> {
                if (DateUtil.isCellDateFormatted(cell)) {
                    yield cell.getLocalDateTimeCellValue().toString();
                }
                double val = cell.getNumericCellValue();
                yield val == Math.floor(val) && !Double.isInfinite(val)
                        ? String.valueOf((long) val)
                        : String.valueOf(val);
            }
            case BOOLEAN -> String.valueOf(cell.getBooleanCellValue());
            default -> "";
        };
    }
}
