package com.bmsedge.forecast.service;

import com.bmsedge.forecast.model.ForecastAlert;
import com.bmsedge.forecast.model.ForecastLine;
import com.bmsedge.forecast.model.ForecastRun;
import com.bmsedge.forecast.model.ForecastWeek;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Excel documents: the order sheet of a recorded run and the blank sales upload template.
 */
@Service
public class ForecastExportService {

    private static final Logger logger = LoggerFactory.getLogger(ForecastExportService.class);

    private static final DateTimeFormatter DAY_HEADER = DateTimeFormatter.ofPattern("EEE dd/MM", Locale.ENGLISH);

    @Autowired
    private ForecastRunRecorder forecastRunRecorder;

    /**
     * Order sheet: Item Name | Weekly Total | MON..SAT | Notes, plus an Alerts sheet.
     */
    @Transactional(readOnly = true)
    public byte[] exportRun(Long runId) throws IOException {
        ForecastRun run = forecastRunRecorder.getRun(runId);

        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle dataStyle = createDataStyle(workbook);

            XSSFSheet sheet = workbook.createSheet("Order_Sheet");
            List<LocalDate> dates = ForecastWeek.operatingDates(run.getWeekStartDate());

            Row title = sheet.createRow(0);
            title.createCell(0).setCellValue("Production forecast, week of " + run.getWeekStartDate()
                    + " (run " + run.getId() + ")");

            Row headerRow = sheet.createRow(2);
            writeHeader(headerRow, 0, "Item Name", headerStyle);
            writeHeader(headerRow, 1, "Weekly Total", headerStyle);
            for (int i = 0; i < dates.size(); i++) {
                writeHeader(headerRow, 2 + i, dates.get(i).format(DAY_HEADER).toUpperCase(), headerStyle);
            }
            writeHeader(headerRow, 2 + dates.size(), "Notes", headerStyle);

            int rowIdx = 3;
            for (ForecastLine line : run.getLines()) {
                Row row = sheet.createRow(rowIdx++);
                writeCell(row, 0, line.getItemName(), dataStyle);
                writeCell(row, 1, line.getWeeklyTotal(), dataStyle);
                for (int i = 0; i < dates.size(); i++) {
                    DayOfWeek day = dates.get(i).getDayOfWeek();
                    writeCell(row, 2 + i, line.getQuantity(day), dataStyle);
                }
                writeCell(row, 2 + dates.size(), line.getNote(), dataStyle);
            }

            sheet.setColumnWidth(0, 9000);
            for (int i = 1; i <= dates.size() + 1; i++) {
                sheet.setColumnWidth(i, 3500);
            }
            sheet.setColumnWidth(2 + dates.size(), 14000);
            sheet.createFreezePane(1, 3);

            writeAlertsSheet(workbook, run, headerStyle, dataStyle);

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            workbook.write(outputStream);
            logger.info("Exported run {} with {} lines", run.getId(), run.getLines().size());
            return outputStream.toByteArray();
        }
    }

    public byte[] generateSalesTemplate() throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = createHeaderStyle(workbook);
            XSSFSheet sheet = workbook.createSheet("Sales_Upload");

            String[] headers = {"date", "item_name", "quantity_sold"};
            Row headerRow = sheet.createRow(0);
            for (int i = 0; i < headers.length; i++) {
                writeHeader(headerRow, i, headers[i], headerStyle);
                sheet.setColumnWidth(i, 5000);
            }

            LocalDate monday = ForecastWeek.nextMonday(LocalDate.now()).minusWeeks(1);
            Object[][] samples = {
                    {monday, "Croissant", 42},
                    {monday, "Sourdough Loaf", 18},
                    {monday.plusDays(1), "Croissant", 39}
            };
            for (int r = 0; r < samples.length; r++) {
                Row row = sheet.createRow(r + 1);
                row.createCell(0).setCellValue(samples[r][0].toString());
                row.createCell(1).setCellValue((String) samples[r][1]);
                row.createCell(2).setCellValue((Integer) samples[r][2]);
            }

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            workbook.write(outputStream);
            return outputStream.toByteArray();
        }
    }

    private void writeAlertsSheet(XSSFWorkbook workbook, ForecastRun run, CellStyle headerStyle, CellStyle dataStyle) {
        XSSFSheet sheet = workbook.createSheet("Alerts");
        Row headerRow = sheet.createRow(0);
        String[] headers = {"Item Name", "Date", "Reason", "Detail"};
        for (int i = 0; i < headers.length; i++) {
            writeHeader(headerRow, i, headers[i], headerStyle);
        }

        Map<Long, String> names = new HashMap<>();
        run.getLines().forEach(l -> names.put(l.getItemId(), l.getItemName()));

        int rowIdx = 1;
        for (ForecastAlert alert : run.getAlerts()) {
            Row row = sheet.createRow(rowIdx++);
            writeCell(row, 0, names.getOrDefault(alert.getItemId(), String.valueOf(alert.getItemId())), dataStyle);
            writeCell(row, 1, alert.getForecastDate().toString(), dataStyle);
            writeCell(row, 2, alert.getReason(), dataStyle);
            writeCell(row, 3, alert.getDetail(), dataStyle);
        }
        sheet.setColumnWidth(0, 9000);
        sheet.setColumnWidth(1, 3500);
        sheet.setColumnWidth(2, 7000);
        sheet.setColumnWidth(3, 14000);
    }

    private void writeHeader(Row row, int col, String value, CellStyle style) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }

    private void writeCell(Row row, int col, Object value, CellStyle style) {
        Cell cell = row.createCell(col);
        if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value != null) {
            cell.setCellValue(value.toString());
        }
        cell.setCellStyle(style);
    }

    private CellStyle createHeaderStyle(XSSFWorkbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        font.setColor(IndexedColors.WHITE.getIndex());
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.DARK_GREEN.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setBorderBottom(BorderStyle.THIN);
        style.setAlignment(HorizontalAlignment.CENTER);
        return style;
    }

    private CellStyle createDataStyle(XSSFWorkbook workbook) {
        CellStyle style = workbook.createCellStyle();
        style.setBorderBottom(BorderStyle.HAIR);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        return style;
    }
}
