package com.bmsedge.forecast.controller;

import com.bmsedge.forecast.dto.SignalImportResult;
import com.bmsedge.forecast.service.SignalImportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Manual holiday/event calendars and weather readings.
 */
@RestController
@RequestMapping("/api/signals")
@CrossOrigin(origins = "*", maxAge = 3600)
public class SignalController {

    private static final Logger logger = LoggerFactory.getLogger(SignalController.class);

    @Autowired
    private SignalImportService signalImportService;

    /**
     * POST /api/signals/events/upload  (date, event_name, event_type, uplift_pct[, weight])
     */
    @PostMapping("/events/upload")
    public ResponseEntity<SignalImportResult> uploadEvents(@RequestParam("file") MultipartFile file) throws IOException {
        logger.info("Received events upload: file={}", file.getOriginalFilename());
        return ResponseEntity.ok(signalImportService.importEvents(file));
    }

    /**
     * POST /api/signals/weather/upload  (date, max_temp, rain_mm[, location])
     */
    @PostMapping("/weather/upload")
    public ResponseEntity<SignalImportResult> uploadWeather(@RequestParam("file") MultipartFile file) throws IOException {
        logger.info("Received weather upload: file={}", file.getOriginalFilename());
        return ResponseEntity.ok(signalImportService.importWeather(file));
    }
}
