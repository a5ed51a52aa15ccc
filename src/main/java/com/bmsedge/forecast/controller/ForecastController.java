package com.bmsedge.forecast.controller;

import com.bmsedge.forecast.dto.ForecastRequest;
import com.bmsedge.forecast.dto.ForecastRunResponse;
import com.bmsedge.forecast.dto.ForecastRunSummary;
import com.bmsedge.forecast.service.ForecastExportService;
import com.bmsedge.forecast.service.ForecastService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/forecasts")
@CrossOrigin(origins = "*", maxAge = 3600)
public class ForecastController {

    private static final Logger logger = LoggerFactory.getLogger(ForecastController.class);

    @Autowired
    private ForecastService forecastService;

    @Autowired
    private ForecastExportService forecastExportService;

    /**
     * Generate and record a forecast run
     * POST /api/forecasts
     */
    @PostMapping
    public ResponseEntity<ForecastRunResponse> createForecast(@Valid @RequestBody ForecastRequest request) {
        logger.info("Forecast requested: week={}, alpha={}, useModel={}",
                request.getWeekStart(), request.getAlpha(), request.getUseModel());

        ForecastRunResponse run = forecastService.forecast(
                request.getWeekStart(),
                request.getAlpha() != null ? request.getAlpha() : 0.0,
                request.getUseModel() == null || request.getUseModel());
        return ResponseEntity.status(HttpStatus.CREATED).body(run);
    }

    @GetMapping("/runs")
    public ResponseEntity<List<ForecastRunResponse>> getRunsForWeek(
            @RequestParam("week") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate week) {
        return ResponseEntity.ok(forecastService.getRunsForWeek(week));
    }

    /**
     * Most recent run, optionally for one week
     * GET /api/forecasts/latest?week=2025-04-21
     */
    @GetMapping("/latest")
    public ResponseEntity<ForecastRunResponse> getLatestRun(
            @RequestParam(value = "week", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate week) {
        return ResponseEntity.ok(forecastService.getLatestRun(week));
    }

    @GetMapping("/runs/{id}")
    public ResponseEntity<ForecastRunResponse> getRun(@PathVariable Long id) {
        return ResponseEntity.ok(forecastService.getRun(id));
    }

    /**
     * Order sheet of a run as Excel
     * GET /api/forecasts/runs/{id}/export
     */
    @GetMapping("/runs/{id}/export")
    public ResponseEntity<Resource> exportRun(@PathVariable Long id) throws IOException {
        byte[] excelBytes = forecastExportService.exportRun(id);
        String filename = "Forecast_Run_" + id + ".xlsx";
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"))
                .contentLength(excelBytes.length)
                .body(new ByteArrayResource(excelBytes));
    }

    @GetMapping("/history")
    public ResponseEntity<Map<String, Object>> getHistory(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        Page<ForecastRunSummary> runs = forecastService.getHistory(page, size);

        Map<String, Object> response = new HashMap<>();
        response.put("runs", runs.getContent());
        response.put("page", runs.getNumber());
        response.put("size", runs.getSize());
        response.put("totalRuns", runs.getTotalElements());
        response.put("totalPages", runs.getTotalPages());
        return ResponseEntity.ok(response);
    }
}
