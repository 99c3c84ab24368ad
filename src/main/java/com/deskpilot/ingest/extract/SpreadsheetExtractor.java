package com.deskpilot.ingest.extract;

import com.deskpilot.model.ExtractedUnit;
import com.deskpilot.model.SourceDocument;
import com.deskpilot.util.LogSanitizer;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Workbook extraction. The first non-empty row of each sheet is treated as its header and
 * every data cell is rendered as {@code Header: value}, so a passage keeps its tabular
 * meaning once it is cut out of the sheet. Rows are grouped into contiguous ranges, one unit
 * per range, labelled {@code sheet:<name>:rows-<first>-<last>:<rows>x<cols>}.
 */
@Component
public class SpreadsheetExtractor implements DocumentExtractor {
    private static final Logger log = LoggerFactory.getLogger(SpreadsheetExtractor.class);

    @Value("${deskpilot.ingest.tabular.rows-per-unit:20}")
    private int rowsPerUnit = 20;

    @Override
    public FormatFamily family() {
        return FormatFamily.SPREADSHEET;
    }

    @Override
    public Set<String> formats() {
        return Set.of("xlsx", "xls");
    }

    @Override
    public List<ExtractedUnit> extract(SourceDocument document) {
        ArrayList<ExtractedUnit> units = new ArrayList<>();
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(document.payload()))) {
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            for (int s = 0; s < workbook.getNumberOfSheets(); s++) {
                Sheet sheet = workbook.getSheetAt(s);
                units.addAll(this.extractSheet(document.id(), sheet, formatter, evaluator));
            }
        }
        catch (ExtractionException e) {
            throw e;
        }
        catch (Exception e) {
            throw new ExtractionException("Error processing Excel file " + document.filename() + ": " + e.getMessage(), e);
        }
        log.debug("Extracted {} row-range unit(s) from {}", units.size(), LogSanitizer.sanitize(document.filename()));
        return units;
    }

    private List<ExtractedUnit> extractSheet(String documentId, Sheet sheet, DataFormatter formatter, FormulaEvaluator evaluator) {
        List<String> header = null;
        ArrayList<SheetRow> dataRows = new ArrayList<>();
        int columnCount = 0;
        for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum() && r >= 0; r++) {
            List<String> cells = readCells(sheet.getRow(r), formatter, evaluator);
            if (cells.stream().allMatch(String::isBlank)) {
                continue;
            }
            columnCount = Math.max(columnCount, cells.size());
            if (header == null) {
                header = cells;
                continue;
            }
            dataRows.add(new SheetRow(r + 1, cells));
        }
        if (header == null || dataRows.isEmpty()) {
            return List.of();
        }
        ArrayList<ExtractedUnit> units = new ArrayList<>();
        int perUnit = Math.max(1, this.rowsPerUnit);
        for (int start = 0; start < dataRows.size(); start += perUnit) {
            List<SheetRow> range = dataRows.subList(start, Math.min(dataRows.size(), start + perUnit));
            units.add(this.toUnit(documentId, sheet.getSheetName(), header, columnCount, range));
        }
        return units;
    }

    private ExtractedUnit toUnit(String documentId, String sheetName, List<String> header, int columnCount, List<SheetRow> rows) {
        int firstRow = rows.get(0).rowNumber();
        int lastRow = rows.get(rows.size() - 1).rowNumber();
        StringBuilder text = new StringBuilder();
        text.append("Sheet: ").append(sheetName).append('\n');
        for (SheetRow row : rows) {
            ArrayList<String> rendered = new ArrayList<>();
            for (int c = 0; c < row.cells().size(); c++) {
                String value = row.cells().get(c);
                if (value.isBlank()) {
                    continue;
                }
                rendered.add(headerName(header, c) + ": " + value);
            }
            text.append("Row ").append(row.rowNumber()).append(": ").append(String.join("; ", rendered)).append('\n');
        }
        String label = "sheet:" + sheetName + ":rows-" + firstRow + "-" + lastRow + ":" + rows.size() + "x" + columnCount;
        LinkedHashMap<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("sheet_name", sheetName);
        attributes.put("first_row", firstRow);
        attributes.put("last_row", lastRow);
        attributes.put("row_count", rows.size());
        attributes.put("column_count", columnCount);
        return new ExtractedUnit(documentId, text.toString().strip(), label, 1.0, attributes);
    }

    private static List<String> readCells(Row row, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (row == null || row.getLastCellNum() <= 0) {
            return List.of();
        }
        ArrayList<String> cells = new ArrayList<>(row.getLastCellNum());
        for (int c = 0; c < row.getLastCellNum(); c++) {
            Cell cell = row.getCell(c);
            String value = cell == null ? "" : formatter.formatCellValue(cell, evaluator);
            cells.add(value == null ? "" : value.replace('\n', ' ').trim());
        }
        // trailing blanks carry no information and would inflate the column count
        int end = cells.size();
        while (end > 0 && cells.get(end - 1).isBlank()) {
            end--;
        }
        return cells.subList(0, end);
    }

    private static String headerName(List<String> header, int column) {
        if (column < header.size() && !header.get(column).isBlank()) {
            return header.get(column);
        }
        return "Column " + (column + 1);
    }

    private record SheetRow(int rowNumber, List<String> cells) {
    }
}
