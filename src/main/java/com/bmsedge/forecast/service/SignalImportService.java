package com.bmsedge.forecast.service;

import com.bmsedge.forecast.config.ForecastSettings;
import com.bmsedge.forecast.dto.RejectedRow;
import com.bmsedge.forecast.dto.SignalImportResult;
import com.bmsedge.forecast.exception.BusinessException;
import com.bmsedge.forecast.exception.SchemaException;
import com.bmsedge.forecast.model.CalendarEvent;
import com.bmsedge.forecast.model.SignalKind;
import com.bmsedge.forecast.model.WeatherObservation;
import com.bmsedge.forecast.repository.CalendarEventRepository;
import com.bmsedge.forecast.repository.WeatherObservationRepository;
import com.bmsedge.forecast.util.DateFormats;
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
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Imports operator-maintained holiday/event calendars and weather readings that back the stored feeds.
 */
@Service
public class SignalImportService {

    private static final Logger logger = LoggerFactory.getLogger(SignalImportService.class);

    private static final String[] DATE_HEADERS = {"date", "event_date", "event date", "day"};
    private static final String[] EVENT_NAME_HEADERS = {"event_name", "event name", "name", "holiday", "event"};
    private static final String[] EVENT_TYPE_HEADERS = {"event_type", "event type", "type", "kind"};
    private static final String[] UPLIFT_HEADERS = {"uplift_pct", "uplift pct", "uplift %", "uplift"};
    private static final String[] WEIGHT_HEADERS = {"weight", "confidence"};
    private static final String[] TEMP_HEADERS = {"max_temp", "max temp", "temp_max", "temperature"};
    private static final String[] RAIN_HEADERS = {"rain_mm", "rain mm", "rain", "precipitation", "precip_mm"};
    private static final String[] LOCATION_HEADERS = {"location", "site"};

    @Autowired
    private SpreadsheetReader spreadsheetReader;

    @Autowired
    private CalendarEventRepository calendarEventRepository;

    @Autowired
    private WeatherObservationRepository weatherObservationRepository;

    @Autowired
    private ForecastSettings settings;

    // ==================== EVENTS ====================

    @Transactional
    public SignalImportResult importEvents(MultipartFile file) throws IOException {
        try (InputStream in = openUpload(file)) {
            return importEvents(spreadsheetReader.read(file.getOriginalFilename(), in));
        }
    }

    /**
     * Replaces all calendar events between the first and last date of the file.
     */
    @Transactional
    public SignalImportResult importEvents(RawTable table) {
        List<String> headers = table.getHeaders();
        int dateCol = findColumn(headers, DATE_HEADERS);
        int nameCol = findColumn(headers, EVENT_NAME_HEADERS);
        List<String> missing = new ArrayList<>();
        if (dateCol < 0) missing.add("date");
        if (nameCol < 0) missing.add("event_name");
        if (!missing.isEmpty()) {
            throw new SchemaException(missing, headers);
        }
        int typeCol = findColumn(headers, EVENT_TYPE_HEADERS);
        int upliftCol = findColumn(headers, UPLIFT_HEADERS);
        int weightCol = findColumn(headers, WEIGHT_HEADERS);

        SignalImportResult result = newResult(table, "EVENTS");
        List<CalendarEvent> events = new ArrayList<>();
        for (RawTable.RawRow row : table.getRows()) {
            String ref = "row " + row.getRowNumber();
            LocalDate date = DateFormats.parse(row.get(dateCol));
            if (date == null) {
                result.getRejectedRows().add(new RejectedRow(ref, null, "unparseable date '" + row.get(dateCol) + "'"));
                continue;
            }
            String name = row.get(nameCol);
            if (name.isEmpty()) {
                result.getRejectedRows().add(new RejectedRow(ref, null, "missing event name"));
                continue;
            }
            String upliftText = upliftCol >= 0 ? row.get(upliftCol) : "";
            BigDecimal uplift = upliftText.isEmpty() ? BigDecimal.ZERO : parseNumber(upliftText);
            if (uplift == null) {
                result.getRejectedRows().add(new RejectedRow(ref, name, "unparseable uplift '" + upliftText + "'"));
                continue;
            }
            BigDecimal weight = weightCol >= 0 ? parseNumber(row.get(weightCol)) : null;

            CalendarEvent event = new CalendarEvent();
            event.setEventDate(date);
            event.setEventName(name);
            event.setKind(parseKind(typeCol >= 0 ? row.get(typeCol) : ""));
            event.setUpliftPct(uplift);
            if (weight != null) {
                event.setWeight(weight.max(BigDecimal.ZERO).min(BigDecimal.ONE));
            }
            events.add(event);
            trackDate(result, date);
        }

        if (!events.isEmpty()) {
            int removed = calendarEventRepository.deleteByDateRange(result.getMinDate(), result.getMaxDate());
            calendarEventRepository.saveAll(events);
            result.setReplaced(removed);
        }
        result.setImported(events.size());
        logger.info("Imported {} calendar events from '{}' ({} replaced, {} rejected)",
                events.size(), table.getSourceName(), result.getReplaced(), result.getRejectedRows().size());
        return result;
    }

    // ==================== WEATHER ====================

    @Transactional
    public SignalImportResult importWeather(MultipartFile file) throws IOException {
        try (InputStream in = openUpload(file)) {
            return importWeather(spreadsheetReader.read(file.getOriginalFilename(), in));
        }
    }

    /**
     * Upserts one observation per (location, date). Rows without a location use the configured one.
     */
    @Transactional
    public SignalImportResult importWeather(RawTable table) {
        List<String> headers = table.getHeaders();
        int dateCol = findColumn(headers, DATE_HEADERS);
        int tempCol = findColumn(headers, TEMP_HEADERS);
        int rainCol = findColumn(headers, RAIN_HEADERS);
        List<String> missing = new ArrayList<>();
        if (dateCol < 0) missing.add("date");
        if (tempCol < 0 && rainCol < 0) missing.add("max_temp or rain_mm");
        if (!missing.isEmpty()) {
            throw new SchemaException(missing, headers);
        }
        int locationCol = findColumn(headers, LOCATION_HEADERS);

        SignalImportResult result = newResult(table, "WEATHER");
        LocalDateTime now = LocalDateTime.now();
        int imported = 0;
        int replaced = 0;
        for (RawTable.RawRow row : table.getRows()) {
            String ref = "row " + row.getRowNumber();
            LocalDate date = DateFormats.parse(row.get(dateCol));
            if (date == null) {
                result.getRejectedRows().add(new RejectedRow(ref, null, "unparseable date '" + row.get(dateCol) + "'"));
                continue;
            }
            BigDecimal temp = tempCol >= 0 ? parseNumber(row.get(tempCol)) : null;
            BigDecimal rain = rainCol >= 0 ? parseNumber(row.get(rainCol)) : null;
            if (temp == null && rain == null) {
                result.getRejectedRows().add(new RejectedRow(ref, null, "no temperature or rainfall value"));
                continue;
            }
            String location = locationCol >= 0 && !row.get(locationCol).isEmpty()
                    ? row.get(locationCol)
                    : settings.getLocation();

            Optional<WeatherObservation> existing =
                    weatherObservationRepository.findByLocationAndObservationDate(location, date);
            WeatherObservation observation = existing.orElseGet(WeatherObservation::new);
            if (existing.isPresent()) {
                replaced++;
            }
            observation.setLocation(location);
            observation.setObservationDate(date);
            observation.setMaxTemp(temp != null ? temp.doubleValue() : null);
            observation.setRainMm(rain != null ? Math.max(0.0, rain.doubleValue()) : null);
            observation.setSource("upload");
            observation.setRecordedAt(now);
            weatherObservationRepository.save(observation);
            imported++;
            trackDate(result, date);
        }

        result.setImported(imported);
        result.setReplaced(replaced);
        logger.info("Imported {} weather observations from '{}' ({} replaced, {} rejected)",
                imported, table.getSourceName(), replaced, result.getRejectedRows().size());
        return result;
    }

    // ==================== HELPERS ====================

    private InputStream openUpload(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new BusinessException("File is empty");
        }
        return file.getInputStream();
    }

    private SignalImportResult newResult(RawTable table, String type) {
        SignalImportResult result = new SignalImportResult();
        result.setFileName(table.getSourceName());
        result.setSignalType(type);
        return result;
    }

    private static void trackDate(SignalImportResult result, LocalDate date) {
        if (result.getMinDate() == null || date.isBefore(result.getMinDate())) result.setMinDate(date);
        if (result.getMaxDate() == null || date.isAfter(result.getMaxDate())) result.setMaxDate(date);
    }

    private static int findColumn(List<String> headers, String[] synonyms) {
        for (String synonym : synonyms) {
            for (int i = 0; i < headers.size(); i++) {
                if (SalesExportNormalizer.normalizeHeader(headers.get(i)).equals(synonym)) {
                    return i;
                }
            }
        }
        return -1;
    }

    static SignalKind parseKind(String value) {
        String lower = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        if (lower.contains("holiday") || lower.equals("public")) {
            return SignalKind.HOLIDAY;
        }
        return SignalKind.EVENT;
    }

    private static BigDecimal parseNumber(String value) {
        String cleaned = value == null ? "" : value.replace("%", "").replace("+", "").trim();
        if (cleaned.isEmpty()) return null;
        return SalesExportNormalizer.parseQuantity(cleaned);
    }
}
