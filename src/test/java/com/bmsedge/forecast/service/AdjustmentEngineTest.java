package com.bmsedge.forecast.service;

import com.bmsedge.forecast.config.ForecastSettings;
import com.bmsedge.forecast.exception.SignalUnavailableException;
import com.bmsedge.forecast.feed.HolidayFeed;
import com.bmsedge.forecast.feed.WeatherFeed;
import com.bmsedge.forecast.model.AdjustmentSignal;
import com.bmsedge.forecast.model.DayAdjustment;
import com.bmsedge.forecast.model.Item;
import com.bmsedge.forecast.model.SignalKind;
import com.bmsedge.forecast.model.WeatherConditions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.Spy;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AdjustmentEngineTest {

    private static final LocalDate DATE = LocalDate.of(2025, 4, 25);

    @Mock
    private WeatherFeed weatherFeed;

    @Mock
    private HolidayFeed holidayFeed;

    @Spy
    private ForecastSettings settings = new ForecastSettings();

    @InjectMocks
    private AdjustmentEngine adjustmentEngine;

    private Item item;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        item = new Item("Croissant");
        item.setId(1L);
        when(weatherFeed.get(any(LocalDate.class), anyString())).thenReturn(Optional.empty());
        when(holidayFeed.get(any(LocalDate.class))).thenReturn(List.of());
    }

    @Test
    @DisplayName("No signals gives a neutral multiplier")
    void testNeutralWithoutSignals() {
        DayAdjustment adjustment = adjustmentEngine.adjust(item, DATE);

        assertEquals(1.0, adjustment.getMultiplier(), 1e-9);
        assertTrue(adjustment.getNotes().isEmpty());
    }

    @Test
    @DisplayName("A holiday uplift is applied and described in the note")
    void testHolidaySignal() {
        // Arrange
        when(holidayFeed.get(DATE)).thenReturn(List.of(
                new AdjustmentSignal(DATE, SignalKind.HOLIDAY, "Anzac Day", 1.15, 1.0)));

        // Act
        DayAdjustment adjustment = adjustmentEngine.adjust(item, DATE);

        // Assert
        assertEquals(1.15, adjustment.getMultiplier(), 1e-9);
        assertEquals(List.of("2025-04-25 Anzac Day +15%"), adjustment.getNotes());
    }

    @Test
    @DisplayName("Signal weight scales the deviation from neutral and coinciding signals multiply")
    void testWeightedSignalsCompose() {
        when(holidayFeed.get(DATE)).thenReturn(List.of(
                new AdjustmentSignal(DATE, SignalKind.HOLIDAY, "Public holiday", 1.2, 0.5),
                new AdjustmentSignal(DATE, SignalKind.EVENT, "Street fair", 1.1, 1.0)));

        DayAdjustment adjustment = adjustmentEngine.adjust(item, DATE);

        assertEquals(1.1 * 1.1, adjustment.getMultiplier(), 1e-9);
    }

    @Test
    @DisplayName("The combined multiplier is clamped to the configured band")
    void testClamp() {
        when(holidayFeed.get(DATE)).thenReturn(List.of(
                new AdjustmentSignal(DATE, SignalKind.EVENT, "Festival", 2.0, 1.0),
                new AdjustmentSignal(DATE, SignalKind.EVENT, "Parade", 1.5, 1.0)));

        assertEquals(1.5, adjustmentEngine.adjust(item, DATE).getMultiplier(), 1e-9);

        when(holidayFeed.get(DATE)).thenReturn(List.of(
                new AdjustmentSignal(DATE, SignalKind.EVENT, "Road closure", 0.2, 1.0)));

        assertEquals(0.5, adjustmentEngine.adjust(item, DATE).getMultiplier(), 1e-9);
    }

    @Test
    @DisplayName("An unavailable feed degrades to neutral instead of failing")
    void testUnavailableFeedIsNeutral() {
        when(holidayFeed.get(DATE)).thenThrow(new SignalUnavailableException("down", new RuntimeException()));
        when(weatherFeed.get(any(LocalDate.class), anyString()))
                .thenThrow(new SignalUnavailableException("down", new RuntimeException()));

        DayAdjustment adjustment = adjustmentEngine.adjust(item, DATE);

        assertEquals(1.0, adjustment.getMultiplier(), 1e-9);
    }

    @Test
    @DisplayName("Weather uses the item's coefficients around the 20 degree / 1 mm anchors")
    void testWeatherFactor() {
        item.setTempCoefficient(new BigDecimal("0.1"));
        item.setRainCoefficient(new BigDecimal("-0.2"));
        when(weatherFeed.get(eq(DATE), anyString())).thenReturn(Optional.of(
                new WeatherConditions(DATE, 30.0, 6.0, DATE.atStartOfDay().minusDays(1))));

        DayAdjustment adjustment = adjustmentEngine.adjust(item, DATE);

        // (1 + 0.1 * 10 / 10) * (1 - 0.2 * 5 / 10)
        assertEquals(1.1 * 0.9, adjustment.getMultiplier(), 1e-9);
    }

    @Test
    @DisplayName("Without coefficients weather is neutral")
    void testWeatherNeutralWithoutCoefficients() {
        when(weatherFeed.get(eq(DATE), anyString())).thenReturn(Optional.of(
                new WeatherConditions(DATE, 35.0, 20.0, DATE.atStartOfDay())));

        assertEquals(1.0, adjustmentEngine.adjust(item, DATE).getMultiplier(), 1e-9);
    }

    @Test
    @DisplayName("Stale weather readings are ignored")
    void testStaleWeatherIgnored() {
        item.setTempCoefficient(new BigDecimal("0.5"));
        when(weatherFeed.get(eq(DATE), anyString())).thenReturn(Optional.of(
                new WeatherConditions(DATE, 30.0, null, DATE.atStartOfDay().minusDays(30))));

        assertEquals(1.0, adjustmentEngine.adjust(item, DATE).getMultiplier(), 1e-9);
        assertTrue(adjustmentEngine.weather(DATE, false).isPresent());
    }

    @Test
    @DisplayName("The weather factor never goes negative")
    void testWeatherFactorNonNegative() {
        item.setTempCoefficient(new BigDecimal("-2.0"));
        WeatherConditions heat = new WeatherConditions(DATE, 40.0, null, DATE.atStartOfDay());

        assertEquals(0.0, adjustmentEngine.weatherFactor(item, heat), 1e-9);
    }
}
