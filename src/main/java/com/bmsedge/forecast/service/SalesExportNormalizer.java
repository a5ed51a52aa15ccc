package com.bmsedge.forecast.service;

import com.bmsedge.forecast.config.ForecastSettings;
import com.bmsedge.forecast.dto.NormalizedExport;
import com.bmsedge.forecast.dto.RejectedRow;
import com.bmsedge.forecast.exception.SchemaException;
import com.bmsedge.forecast.model.ExportLayout;
import com.bmsedge.forecast.model.TidySaleRow;
import com.bmsedge.forecast.util.DateFormats;
import com.bmsedge.forecast.util.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a raw sales export (wide date-column sheets or tall transaction lists) into
 * tidy, refund-signed, duplicate-aggregated rows.
 */
@Service
public class SalesExportNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(SalesExportNormalizer.class);

    private static final int MAX_SOURCE_REF_LENGTH = 500;

    // "Total", "Totals", "Subtotal", "Grand Total" as whole words; "Totally Nuts" is an item
    private static final Pattern SUMMARY_ROW = Pattern.compile("(?i)\\b(sub|grand\\s*)?totals?\\b");

    @Autowired
    private ForecastSettings settings;

    public NormalizedExport normalize(RawTable table) {
        List<String> headers = table.getHeaders();
        if (headers.isEmpty()) {
            throw new SchemaException(List.of("date", "item", "quantity"), headers);
        }

        List<DateColumn> dateColumns = detectDateColumns(headers);
        List<RejectedRow> rejected = new ArrayList<>();
        List<RejectedRow> skipped = new ArrayList<>();
        List<TidySaleRow> rows;
        ExportLayout layout;

        if (dateColumns.size() >= settings.getWideMinDateColumns()) {
            layout = ExportLayout.WIDE;
            rows = parseWideFormat(table, dateColumns, rejected, skipped);
        } else {
            layout = ExportLayout.TALL;
            rows = parseTallFormat(table, rejected, skipped);
        }

        List<TidySaleRow> aggregated = aggregate(rows);
        logger.info("Normalized '{}' as {}: {} tidy rows ({} before aggregation), {} rejected, {} summary rows skipped",
                table.getSourceName(), layout, aggregated.size(), rows.size(), rejected.size(), skipped.size());
        return new NormalizedExport(layout, aggregated, rejected, skipped);
    }

    // ==================== WIDE ====================

    private List<TidySaleRow> parseWideFormat(RawTable table, List<DateColumn> dateColumns,
                                              List<RejectedRow> rejected, List<RejectedRow> skipped) {
        List<String> headers = table.getHeaders();
        Set<Integer> dateIdx = dateColumns.stream().map(dc -> dc.columnIndex).collect(Collectors.toSet());

        int itemCol = findColumn(headers, settings.getItemHeaders(), dateIdx);
        if (itemCol < 0) {
            throw new SchemaException(List.of("item"), headers);
        }
        Set<Integer> taken = new HashSet<>(dateIdx);
        taken.add(itemCol);
        int variationCol = findColumn(headers, settings.getVariationHeaders(), taken);

        logger.info("  WIDE format detected: item column '{}', {} date columns",
                headers.get(itemCol), dateColumns.size());

        List<TidySaleRow> rows = new ArrayList<>();
        for (RawTable.RawRow row : table.getRows()) {
            String ref = "row " + row.getRowNumber();
            String item = row.get(itemCol);
            if (item.isEmpty()) {
                rejected.add(new RejectedRow(ref, null, "missing item name"));
                continue;
            }
            if (isSummaryRow(item)) {
                skipped.add(new RejectedRow(ref, item, "summary row"));
                continue;
            }
            String name = withVariation(item, variationCol >= 0 ? row.get(variationCol) : "");

            for (DateColumn dc : dateColumns) {
                BigDecimal qty = parseQuantity(row.get(dc.columnIndex));
                if (qty == null || qty.signum() <= 0) {
                    continue;
                }
                rows.add(new TidySaleRow(dc.date, name, qty, false, ref));
            }
        }
        return rows;
    }

    // ==================== TALL ====================

    private List<TidySaleRow> parseTallFormat(RawTable table, List<RejectedRow> rejected,
                                              List<RejectedRow> skipped) {
        List<String> headers = table.getHeaders();

        int dateCol = findColumn(headers, settings.getDateHeaders(), Set.of());
        int itemCol = findColumn(headers, settings.getItemHeaders(), Set.of());
        Set<Integer> taken = new HashSet<>();
        if (dateCol >= 0) taken.add(dateCol);
        if (itemCol >= 0) taken.add(itemCol);
        int qtyCol = findColumn(headers, settings.getQuantityHeaders(), taken);

        List<String> missing = new ArrayList<>();
        if (dateCol < 0) missing.add("date");
        if (itemCol < 0) missing.add("item");
        if (qtyCol < 0) missing.add("quantity");
        if (!missing.isEmpty()) {
            throw new SchemaException(missing, headers);
        }

        taken.add(qtyCol);
        int refundTypeCol = findColumn(headers, settings.getRefundTypeHeaders(), taken);

        logger.info("  TALL format detected: date '{}', item '{}', quantity '{}'",
                headers.get(dateCol), headers.get(itemCol), headers.get(qtyCol));

        List<TidySaleRow> rows = new ArrayList<>();
        for (RawTable.RawRow row : table.getRows()) {
            String ref = "row " + row.getRowNumber();
            String item = row.get(itemCol);
            if (item.isEmpty()) {
                rejected.add(new RejectedRow(ref, null, "missing item name"));
                continue;
            }
            if (isSummaryRow(item)) {
                skipped.add(new RejectedRow(ref, item, "summary row"));
                continue;
            }

            String rawDate = row.get(dateCol);
            LocalDate date = DateFormats.parse(rawDate);
            if (date == null) {
                rejected.add(new RejectedRow(ref, item, "unparseable date '" + rawDate + "'"));
                continue;
            }

            String rawQty = row.get(qtyCol);
            BigDecimal qty = parseQuantity(rawQty);
            if (qty == null) {
                rejected.add(new RejectedRow(ref, item, "unparseable quantity '" + rawQty + "'"));
                continue;
            }

            boolean refund = qty.signum() < 0
                    || (refundTypeCol >= 0 && isRefundType(row.get(refundTypeCol)));
            if (refund) {
                qty = qty.abs().negate();
            }

            rows.add(new TidySaleRow(date, item, qty, refund, ref));
        }
        return rows;
    }

    // ==================== AGGREGATION ====================

    /**
     * Sums rows sharing (date, raw item name). Output is sorted by date then name.
     */
    List<TidySaleRow> aggregate(List<TidySaleRow> rows) {
        Map<AggregateKey, List<TidySaleRow>> groups = new TreeMap<>();
        for (TidySaleRow row : rows) {
            groups.computeIfAbsent(new AggregateKey(row.getDate(), row.getItemNameRaw()), k -> new ArrayList<>())
                    .add(row);
        }

        List<TidySaleRow> result = new ArrayList<>(groups.size());
        for (Map.Entry<AggregateKey, List<TidySaleRow>> entry : groups.entrySet()) {
            List<TidySaleRow> group = entry.getValue();
            if (group.size() == 1) {
                result.add(group.get(0));
                continue;
            }
            BigDecimal total = BigDecimal.ZERO;
            boolean anyRefund = false;
            for (TidySaleRow row : group) {
                total = total.add(row.getQuantity());
                anyRefund |= row.isRefund();
            }
            String refs = group.stream()
                    .map(TidySaleRow::getSourceRowRef)
                    .map(r -> r.startsWith("row ") ? r.substring(4) : r)
                    .distinct()
                    .sorted(Comparator.comparingInt(SalesExportNormalizer::rowNumberOf).thenComparing(s -> s))
                    .collect(Collectors.joining(","));
            result.add(new TidySaleRow(entry.getKey().date, entry.getKey().name, total, anyRefund,
                    truncate("rows " + refs)));
        }
        return result;
    }

    // ==================== HELPERS ====================

    private List<DateColumn> detectDateColumns(List<String> headers) {
        List<DateColumn> dateColumns = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            LocalDate parsed = DateFormats.parse(headers.get(i));
            if (parsed != null) {
                dateColumns.add(new DateColumn(i, parsed));
            }
        }
        return dateColumns;
    }

    /**
     * First header matching a synonym, trying synonyms in their configured order.
     */
    private int findColumn(List<String> headers, String[] synonyms, Set<Integer> exclude) {
        List<String> normalizedHeaders = headers.stream()
                .map(SalesExportNormalizer::normalizeHeader)
                .collect(Collectors.toList());
        for (String synonym : synonyms) {
            String wanted = normalizeHeader(synonym);
            for (int i = 0; i < normalizedHeaders.size(); i++) {
                if (!exclude.contains(i) && normalizedHeaders.get(i).equals(wanted)) {
                    return i;
                }
            }
        }
        return -1;
    }

    static String normalizeHeader(String header) {
        return header == null ? "" : header.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private boolean isRefundType(String value) {
        if (value == null || value.isEmpty()) return false;
        String lower = value.toLowerCase(Locale.ROOT);
        for (String term : settings.getRefundTerms()) {
            if (!term.isBlank() && lower.contains(term.trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    static boolean isSummaryRow(String item) {
        return SUMMARY_ROW.matcher(item).find();
    }

    private static String withVariation(String item, String variation) {
        if (variation == null || variation.isEmpty() || variation.equalsIgnoreCase(item)) {
            return item;
        }
        return item + " - " + variation;
    }

    static BigDecimal parseQuantity(String value) {
        if (value == null) return null;
        String cleaned = value.trim().replace(",", "");
        if (cleaned.isEmpty()) return null;
        // accounting negatives, e.g. "(2)"
        if (cleaned.startsWith("(") && cleaned.endsWith(")")) {
            cleaned = "-" + cleaned.substring(1, cleaned.length() - 1);
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int rowNumberOf(String ref) {
        try {
            return Integer.parseInt(ref);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    private static String truncate(String ref) {
        return ref.length() <= MAX_SOURCE_REF_LENGTH ? ref : ref.substring(0, MAX_SOURCE_REF_LENGTH - 3) + "...";
    }

    // ==================== INNER CLASSES ====================

    private static class DateColumn {
        final int columnIndex;
        final LocalDate date;

        DateColumn(int columnIndex, LocalDate date) {
            this.columnIndex = columnIndex;
            this.date = date;
        }
    }

    private static class AggregateKey implements Comparable<AggregateKey> {
        final LocalDate date;
        final String name;

        AggregateKey(LocalDate date, String name) {
            this.date = date;
            this.name = name;
        }

        @Override
        public int compareTo(AggregateKey other) {
            int byDate = date.compareTo(other.date);
            return byDate != 0 ? byDate : name.compareTo(other.name);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof AggregateKey)) return false;
            AggregateKey that = (AggregateKey) o;
            return date.equals(that.date) && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(date, name);
        }
    }
}
