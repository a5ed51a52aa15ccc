package com.bmsedge.forecast.service;

import com.bmsedge.forecast.model.ForecastAlert;
import com.bmsedge.forecast.model.ForecastLine;
import com.bmsedge.forecast.model.ForecastRun;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ForecastExportServiceTest {

    private static final LocalDate WEEK_START = LocalDate.of(2025, 4, 21);

    @Mock
    private ForecastRunRecorder forecastRunRecorder;

    @InjectMocks
    private ForecastExportService exportService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    @DisplayName("The order sheet lists one row per item with day columns and notes")
    void testExportRun() throws IOException {
        // Arrange
        Map<DayOfWeek, Integer> quantities = new EnumMap<>(DayOfWeek.class);
        quantities.put(DayOfWeek.MONDAY, 40);
        quantities.put(DayOfWeek.FRIDAY, 65);
        ForecastRun run = new ForecastRun(WEEK_START, new BigDecimal("0.250"), true, LocalDateTime.now());
        run.addLine(new ForecastLine(1L, "Croissant", quantities, true, false, "As expected"));
        run.addAlert(new ForecastAlert(1L, WEEK_START.plusDays(4), ForecastAlert.DEVIATES_FROM_HISTORY, "forecast 65.0"));
        when(forecastRunRecorder.getRun(5L)).thenReturn(run);

        // Act
        byte[] bytes = exportService.exportRun(5L);

        // Assert
        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            Sheet sheet = workbook.getSheet("Order_Sheet");
            assertNotNull(sheet);
            Row header = sheet.getRow(2);
            assertEquals("Item Name", header.getCell(0).getStringCellValue());
            assertEquals("MON 21/04", header.getCell(2).getStringCellValue());
            assertEquals("SAT 26/04", header.getCell(7).getStringCellValue());
            assertEquals("Notes", header.getCell(8).getStringCellValue());

            Row line = sheet.getRow(3);
            assertEquals("Croissant", line.getCell(0).getStringCellValue());
            assertEquals(105.0, line.getCell(1).getNumericCellValue());
            assertEquals(65.0, line.getCell(6).getNumericCellValue());
            assertEquals(0.0, line.getCell(7).getNumericCellValue());

            Sheet alerts = workbook.getSheet("Alerts");
            assertEquals("Croissant", alerts.getRow(1).getCell(0).getStringCellValue());
            assertEquals(ForecastAlert.DEVIATES_FROM_HISTORY, alerts.getRow(1).getCell(2).getStringCellValue());
        }
    }

    @Test
    @DisplayName("The sales template carries the canonical upload columns")
    void testSalesTemplate() throws IOException {
        byte[] bytes = exportService.generateSalesTemplate();

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            Row header = workbook.getSheetAt(0).getRow(0);
            assertEquals("date", header.getCell(0).getStringCellValue());
            assertEquals("item_name", header.getCell(1).getStringCellValue());
            assertEquals("quantity_sold", header.getCell(2).getStringCellValue());
            assertEquals(3, workbook.getSheetAt(0).getLastRowNum());
        }
    }
}
