package com.bmsedge.forecast.util;

import com.bmsedge.forecast.exception.BusinessException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.apache.poi.ss.usermodel.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the first sheet of an Excel workbook, or a CSV file, into a {@link RawTable}.
 * Date cells become ISO dates and numeric cells plain decimal strings.
 */
@Component
public class SpreadsheetReader {

    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetReader.class);

    private static final int HEADER_SCAN_ROWS = 5;

    public RawTable read(String fileName, InputStream input) throws IOException {
        if (fileName == null || fileName.trim().isEmpty()) {
            throw new BusinessException("File name cannot be empty");
        }
        String lower = fileName.toLowerCase();
        if (lower.endsWith(".csv")) {
            return readCsv(fileName, input);
        }
        if (lower.endsWith(".xlsx") || lower.endsWith(".xls")) {
            return readWorkbook(fileName, input);
        }
        throw new BusinessException("Unsupported file format. Please upload CSV (.csv) or Excel (.xlsx, .xls) files only.");
    }

    private RawTable readCsv(String fileName, InputStream input) throws IOException {
        List<String[]> lines;
        try (CSVReader reader = new CSVReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            lines = reader.readAll();
        } catch (CsvException e) {
            throw new IOException("Failed to read CSV file: " + e.getMessage(), e);
        }

        int headerIdx = -1;
        for (int i = 0; i < Math.min(HEADER_SCAN_ROWS, lines.size()); i++) {
            if (countNonBlank(lines.get(i)) >= 2) {
                headerIdx = i;
                break;
            }
        }
        if (headerIdx < 0) {
            return new RawTable(fileName, List.of(), List.of());
        }

        List<String> headers = new ArrayList<>();
        for (String h : lines.get(headerIdx)) {
            headers.add(stripBom(h).trim());
        }

        List<RawTable.RawRow> rows = new ArrayList<>();
        for (int i = headerIdx + 1; i < lines.size(); i++) {
            RawTable.RawRow row = new RawTable.RawRow(i + 1, List.of(lines.get(i)));
            if (!row.isBlank()) {
                rows.add(row);
            }
        }
        logger.info("Read CSV '{}': {} columns, {} rows", fileName, headers.size(), rows.size());
        return new RawTable(fileName, headers, rows);
    }

    private RawTable readWorkbook(String fileName, InputStream input) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(input)) {
            if (workbook.getNumberOfSheets() == 0) {
                return new RawTable(fileName, List.of(), List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();

            int headerIdx = -1;
            for (int r = sheet.getFirstRowNum(); r <= Math.min(sheet.getFirstRowNum() + HEADER_SCAN_ROWS - 1, sheet.getLastRowNum()); r++) {
                Row row = sheet.getRow(r);
                if (row != null && readCells(row, formatter).stream().filter(v -> !v.isEmpty()).count() >= 2) {
                    headerIdx = r;
                    break;
                }
            }
            if (headerIdx < 0) {
                return new RawTable(fileName, List.of(), List.of());
            }

            List<String> headers = readCells(sheet.getRow(headerIdx), formatter);
            List<RawTable.RawRow> rows = new ArrayList<>();
            for (int r = headerIdx + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) continue;
                RawTable.RawRow rawRow = new RawTable.RawRow(r + 1, readCells(row, formatter));
                if (!rawRow.isBlank()) {
                    rows.add(rawRow);
                }
            }
            logger.info("Read workbook '{}' sheet '{}': {} columns, {} rows",
                    fileName, sheet.getSheetName(), headers.size(), rows.size());
            return new RawTable(fileName, headers, rows);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to read Excel file: " + e.getMessage(), e);
        }
    }

    private List<String> readCells(Row row, DataFormatter formatter) {
        List<String> cells = new ArrayList<>();
        int last = Math.max(row.getLastCellNum(), 0);
        for (int c = 0; c < last; c++) {
            cells.add(getCellValueAsString(row.getCell(c), formatter));
        }
        return cells;
    }

    private String getCellValueAsString(Cell cell, DataFormatter formatter) {
        if (cell == null) return "";
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        switch (type) {
            case STRING:
                return cell.getStringCellValue().trim();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate().toString();
                }
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            case BLANK:
                return "";
            default:
                return formatter.formatCellValue(cell).trim();
        }
    }

    private static long countNonBlank(String[] line) {
        long count = 0;
        for (String value : line) {
            if (value != null && !value.trim().isEmpty()) count++;
        }
        return count;
    }

    private static String stripBom(String value) {
        if (value != null && !value.isEmpty() && value.charAt(0) == '\uFEFF') {
            return value.substring(1);
        }
        return value == null ? "" : value;
    }
}
