package com.bmsedge.forecast.service;

import com.bmsedge.forecast.config.ForecastSettings;
import com.bmsedge.forecast.dto.SignalImportResult;
import com.bmsedge.forecast.exception.SchemaException;
import com.bmsedge.forecast.model.CalendarEvent;
import com.bmsedge.forecast.model.SignalKind;
import com.bmsedge.forecast.model.WeatherObservation;
import com.bmsedge.forecast.repository.CalendarEventRepository;
import com.bmsedge.forecast.repository.WeatherObservationRepository;
import com.bmsedge.forecast.util.RawTable;
import com.bmsedge.forecast.util.SpreadsheetReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.Spy;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SignalImportServiceTest {

    @Mock
    private SpreadsheetReader spreadsheetReader;

    @Mock
    private CalendarEventRepository calendarEventRepository;

    @Mock
    private WeatherObservationRepository weatherObservationRepository;

    @Spy
    private ForecastSettings settings = new ForecastSettings();

    @InjectMocks
    private SignalImportService signalImportService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(weatherObservationRepository.findByLocationAndObservationDate(anyString(), any()))
                .thenReturn(Optional.empty());
    }

    private static RawTable.RawRow row(int number, String... cells) {
        return new RawTable.RawRow(number, Arrays.asList(cells));
    }

    @Test
    @DisplayName("Calendar events replace those stored for the file's date range")
    void testImportEvents() {
        // Arrange
        RawTable table = new RawTable("events.csv", List.of("Date", "Event Name", "Type", "Uplift %", "Weight"), List.of(
                row(2, "25/04/2025", "Anzac Day", "Public Holiday", "15", "1.5"),
                row(3, "2025-04-19", "Street fair", "", "", ""),
                row(4, "someday", "Unknown", "", "10", "")));
        when(calendarEventRepository.deleteByDateRange(any(), any())).thenReturn(3);

        // Act
        SignalImportResult result = signalImportService.importEvents(table);

        // Assert
        assertEquals(2, result.getImported());
        assertEquals(3, result.getReplaced());
        assertEquals(1, result.getRejectedRows().size());
        verify(calendarEventRepository).deleteByDateRange(LocalDate.of(2025, 4, 19), LocalDate.of(2025, 4, 25));

        ArgumentCaptor<List<CalendarEvent>> captor = ArgumentCaptor.forClass(List.class);
        verify(calendarEventRepository).saveAll(captor.capture());
        CalendarEvent anzac = captor.getValue().get(0);
        assertEquals(SignalKind.HOLIDAY, anzac.getKind());
        assertEquals(0, new BigDecimal("15").compareTo(anzac.getUpliftPct()));
        assertEquals(0, BigDecimal.ONE.compareTo(anzac.getWeight()));
        CalendarEvent fair = captor.getValue().get(1);
        assertEquals(SignalKind.EVENT, fair.getKind());
        assertEquals(0, BigDecimal.ZERO.compareTo(fair.getUpliftPct()));
    }

    @Test
    @DisplayName("An events file without a name column is refused")
    void testEventsMissingColumn() {
        RawTable table = new RawTable("events.csv", List.of("Date", "Uplift"), List.of());

        SchemaException ex = assertThrows(SchemaException.class, () -> signalImportService.importEvents(table));

        assertThat(ex.getMissingColumns()).containsExactly("event_name");
        verify(calendarEventRepository, never()).deleteByDateRange(any(), any());
    }

    @Test
    @DisplayName("Weather rows are upserted per location and date")
    void testImportWeather() {
        WeatherObservation stored = new WeatherObservation();
        stored.setLocation("default");
        stored.setObservationDate(LocalDate.of(2025, 4, 14));
        when(weatherObservationRepository.findByLocationAndObservationDate("default", LocalDate.of(2025, 4, 14)))
                .thenReturn(Optional.of(stored));
        RawTable table = new RawTable("weather.csv", List.of("date", "max_temp", "rain_mm"), List.of(
                row(2, "2025-04-14", "24.5", "0"),
                row(3, "2025-04-15", "", "-1"),
                row(4, "2025-04-16", "", "")));

        SignalImportResult result = signalImportService.importWeather(table);

        assertEquals(2, result.getImported());
        assertEquals(1, result.getReplaced());
        assertEquals(1, result.getRejectedRows().size());
        assertEquals(24.5, stored.getMaxTemp());
        assertEquals("upload", stored.getSource());
        assertNotNull(stored.getRecordedAt());
        verify(weatherObservationRepository, times(2)).save(any(WeatherObservation.class));
    }

    @Test
    @DisplayName("Holiday-like type labels map to the holiday kind")
    void testParseKind() {
        assertEquals(SignalKind.HOLIDAY, SignalImportService.parseKind("Public Holiday"));
        assertEquals(SignalKind.HOLIDAY, SignalImportService.parseKind("public"));
        assertEquals(SignalKind.EVENT, SignalImportService.parseKind("Festival"));
        assertEquals(SignalKind.EVENT, SignalImportService.parseKind(null));
    }
}
