package com.bmsedge.forecast.service;

import com.bmsedge.forecast.exception.PersistenceFailureException;
import com.bmsedge.forecast.model.CanonicalSale;
import com.bmsedge.forecast.model.SaleRecord;
import com.bmsedge.forecast.repository.SaleRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;

/**
 * Canonical sales history: one record per (item, date).
 */
@Service
public class SalesStore {

    private static final Logger logger = LoggerFactory.getLogger(SalesStore.class);

    @Autowired
    private SaleRecordRepository saleRecordRepository;

    public int append(List<CanonicalSale> sales) {
        return append(sales, null);
    }

    /**
     * Writes a batch. Sales sharing (item, date) within the batch are summed; a record
     * stored by an earlier batch is replaced by this batch's total.
     *
     * @return number of (item, date) records written
     */
    @Transactional
    public int append(List<CanonicalSale> sales, Long batchId) {
        if (sales.isEmpty()) return 0;

        Map<SaleKey, BigDecimal> totals = new LinkedHashMap<>();
        Map<SaleKey, String> refs = new HashMap<>();
        LocalDate minDate = null;
        LocalDate maxDate = null;
        for (CanonicalSale sale : sales) {
            SaleKey key = new SaleKey(sale.getItemId(), sale.getDate());
            totals.merge(key, sale.getQuantity(), BigDecimal::add);
            if (sale.getSourceRowRef() != null) {
                refs.merge(key, sale.getSourceRowRef(), (a, b) -> a + "; " + b);
            }
            if (minDate == null || sale.getDate().isBefore(minDate)) minDate = sale.getDate();
            if (maxDate == null || sale.getDate().isAfter(maxDate)) maxDate = sale.getDate();
        }

        try {
            Set<Long> itemIds = new HashSet<>();
            totals.keySet().forEach(k -> itemIds.add(k.itemId));

            Map<SaleKey, SaleRecord> existing = new HashMap<>();
            for (SaleRecord record : saleRecordRepository.findByItemIdsAndDateRange(itemIds, minDate, maxDate)) {
                existing.put(new SaleKey(record.getItemId(), record.getSaleDate()), record);
            }

            List<SaleRecord> toSave = new ArrayList<>(totals.size());
            int replaced = 0;
            for (Map.Entry<SaleKey, BigDecimal> entry : totals.entrySet()) {
                SaleKey key = entry.getKey();
                SaleRecord record = existing.get(key);
                if (record != null) {
                    // Update existing record
                    replaced++;
                } else {
                    record = new SaleRecord(key.itemId, key.date, BigDecimal.ZERO);
                }
                record.setQuantity(entry.getValue());
                record.setSourceRowRef(truncate(refs.get(key)));
                record.setBatchId(batchId);
                toSave.add(record);
            }
            saleRecordRepository.saveAll(toSave);

            logger.info("Stored {} sale records ({} replaced) for {} items, {} to {}",
                    toSave.size(), replaced, itemIds.size(), minDate, maxDate);
            return toSave.size();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to store sales batch: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    public List<SaleRecord> query(Long itemId, LocalDate from, LocalDate to) {
        try {
            return saleRecordRepository.findByItemIdAndDateRange(itemId, from, to);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to read sales for item " + itemId, e);
        }
    }

    public List<SaleRecord> history(Long itemId) {
        try {
            return saleRecordRepository.findByItemIdOrderBySaleDateAsc(itemId);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to read sales for item " + itemId, e);
        }
    }

    public Optional<LocalDate> latestSaleDateBefore(LocalDate date) {
        try {
            return saleRecordRepository.findLatestSaleDateBefore(date);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to read latest sale date", e);
        }
    }

    public List<Long> itemIdsWithHistory() {
        try {
            return saleRecordRepository.findDistinctItemIds();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to list items with sales", e);
        }
    }

    private static String truncate(String ref) {
        if (ref == null || ref.length() <= 500) return ref;
        return ref.substring(0, 497) + "...";
    }

    private static final class SaleKey {
        final Long itemId;
        final LocalDate date;

        SaleKey(Long itemId, LocalDate date) {
            this.itemId = itemId;
            this.date = date;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SaleKey)) return false;
            SaleKey that = (SaleKey) o;
            return itemId.equals(that.itemId) && date.equals(that.date);
        }

        @Override
        public int hashCode() {
            return Objects.hash(itemId, date);
        }
    }
}
