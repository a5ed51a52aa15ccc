package com.bmsedge.forecast.controller;

import com.bmsedge.forecast.dto.IngestResult;
import com.bmsedge.forecast.service.ForecastExportService;
import com.bmsedge.forecast.service.SalesIngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Sales export upload (CSV or Excel, tall or wide layout).
 */
@RestController
@RequestMapping("/api/sales")
@CrossOrigin(origins = "*", maxAge = 3600)
public class SalesUploadController {

    private static final Logger logger = LoggerFactory.getLogger(SalesUploadController.class);

    @Autowired
    private SalesIngestionService salesIngestionService;

    @Autowired
    private ForecastExportService forecastExportService;

    /**
     * POST /api/sales/upload
     */
    @PostMapping("/upload")
    public ResponseEntity<Map<String, Object>> uploadSales(@RequestParam("file") MultipartFile file) {
        logger.info("Received sales upload request: file={}, size={}", file.getOriginalFilename(), file.getSize());

        try {
            IngestResult result = salesIngestionService.ingest(file);

            boolean success = result.getAccepted() > 0;
            Map<String, Object> response = new HashMap<>();
            response.put("success", success);
            response.put("result", result);
            response.put("message", success
                    ? String.format("Stored %d sales records from %d rows (%d rejected, %d summary rows skipped).",
                    result.getRecordsWritten(), result.getAccepted(), result.getRejected(), result.getSkipped())
                    : "No valid sales rows found in the file.");

            logger.info("Sales upload result: success={}, accepted={}, rejected={}",
                    success, result.getAccepted(), result.getRejected());
            return ResponseEntity.status(success ? HttpStatus.OK : HttpStatus.BAD_REQUEST).body(response);

        } catch (IOException e) {
            logger.error("Sales upload failed: {}", e.getMessage(), e);

            Map<String, Object> errorResponse = new HashMap<>();
            errorResponse.put("success", false);
            errorResponse.put("message", "Failed to process file: " + e.getMessage());
            errorResponse.put("error", e.getClass().getSimpleName());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
        }
    }

    /**
     * GET /api/sales/template
     */
    @GetMapping("/template")
    public ResponseEntity<Resource> downloadTemplate() throws IOException {
        byte[] excelBytes = forecastExportService.generateSalesTemplate();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"Sales_Upload_Template.xlsx\"")
                .contentType(MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"))
                .contentLength(excelBytes.length)
                .body(new ByteArrayResource(excelBytes));
    }
}
