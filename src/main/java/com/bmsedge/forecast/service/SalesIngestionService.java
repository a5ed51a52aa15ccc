package com.bmsedge.forecast.service;

import com.bmsedge.forecast.config.ForecastSettings;
import com.bmsedge.forecast.dto.IngestResult;
import com.bmsedge.forecast.dto.NormalizedExport;
import com.bmsedge.forecast.dto.RejectedRow;
import com.bmsedge.forecast.exception.BusinessException;
import com.bmsedge.forecast.exception.ResolutionAmbiguityException;
import com.bmsedge.forecast.model.CanonicalSale;
import com.bmsedge.forecast.model.IngestionBatch;
import com.bmsedge.forecast.model.Item;
import com.bmsedge.forecast.model.TidySaleRow;
import com.bmsedge.forecast.repository.IngestionBatchRepository;
import com.bmsedge.forecast.util.RawTable;
import com.bmsedge.forecast.util.SpreadsheetReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ingests one sales export: read, normalize, resolve item names, store. A file is committed
 * as a whole or not at all.
 */
@Service
public class SalesIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(SalesIngestionService.class);

    @Autowired
    private SpreadsheetReader spreadsheetReader;

    @Autowired
    private SalesExportNormalizer normalizer;

    @Autowired
    private ItemResolver itemResolver;

    @Autowired
    private SalesStore salesStore;

    @Autowired
    private IngestionBatchRepository ingestionBatchRepository;

    @Autowired
    private ItemModelTrainingService modelTrainingService;

    @Autowired
    private ForecastSettings settings;

    @Transactional
    public IngestResult ingest(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new BusinessException("File is empty");
        }
        try (InputStream in = file.getInputStream()) {
            return ingest(file.getOriginalFilename(), in);
        }
    }

    @Transactional
    public IngestResult ingest(String fileName, InputStream input) throws IOException {
        logger.info("Ingesting sales export '{}'", fileName);
        RawTable table = spreadsheetReader.read(fileName, input);
        return ingest(table);
    }

    @Transactional
    public IngestResult ingest(RawTable table) {
        NormalizedExport export = normalizer.normalize(table);

        IngestResult result = new IngestResult();
        result.setFileName(table.getSourceName());
        result.setLayout(export.getLayout());
        result.getRejectedRows().addAll(export.getRejectedRows());
        result.getSkippedRows().addAll(export.getSkippedRows());

        ItemResolver.Batch resolution = itemResolver.newBatch();
        List<CanonicalSale> sales = new ArrayList<>();
        Set<Long> touchedItems = new LinkedHashSet<>();
        LocalDate minDate = null;
        LocalDate maxDate = null;

        for (TidySaleRow row : export.getRows()) {
            Item item;
            try {
                item = resolution.resolve(row.getItemNameRaw());
            } catch (ResolutionAmbiguityException e) {
                result.getRejectedRows().add(new RejectedRow(row.getSourceRowRef(), row.getItemNameRaw(),
                        "ambiguous item name, matches " + e.getCandidates()));
                continue;
            } catch (IllegalArgumentException e) {
                result.getRejectedRows().add(new RejectedRow(row.getSourceRowRef(), row.getItemNameRaw(), e.getMessage()));
                continue;
            }

            sales.add(new CanonicalSale(row.getDate(), item.getId(), row.getQuantity(), row.getSourceRowRef()));
            touchedItems.add(item.getId());
            if (minDate == null || row.getDate().isBefore(minDate)) minDate = row.getDate();
            if (maxDate == null || row.getDate().isAfter(maxDate)) maxDate = row.getDate();
        }

        IngestionBatch batch = new IngestionBatch();
        batch.setFileName(table.getSourceName());
        batch.setLayout(export.getLayout());
        batch.setAcceptedRows(sales.size());
        batch.setRejectedRows(result.getRejected());
        batch.setMinDate(minDate);
        batch.setMaxDate(maxDate);
        batch = ingestionBatchRepository.save(batch);

        int written = salesStore.append(sales, batch.getId());
        batch.setRecordsWritten(written);
        ingestionBatchRepository.save(batch);

        result.setBatchId(batch.getId());
        result.setAccepted(sales.size());
        result.setRecordsWritten(written);
        result.setItemsCreated(resolution.getItemsCreated());
        result.setMinDate(minDate);
        result.setMaxDate(maxDate);
        if (sales.isEmpty()) {
            result.getErrors().add("No valid sales rows found in the file.");
        }

        logger.info("Ingested '{}' ({}): {} accepted, {} rejected, {} summary rows skipped, {} records written, {} new items",
                table.getSourceName(), export.getLayout(), sales.size(), result.getRejected(),
                result.getSkipped(), written, resolution.getItemsCreated());

        if (settings.isTrainAfterIngest() && !touchedItems.isEmpty()) {
            result.setTrainResults(modelTrainingService.trainItems(touchedItems));
        }
        return result;
    }
}
