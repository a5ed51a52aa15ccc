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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Weather and holiday/event multipliers per forecast date. Feed failures and stale data
 * count as neutral; the combined product is clamped to the configured band.
 */
@Service
public class AdjustmentEngine {

    private static final Logger logger = LoggerFactory.getLogger(AdjustmentEngine.class);

    @Autowired
    private WeatherFeed weatherFeed;

    @Autowired
    private HolidayFeed holidayFeed;

    @Autowired
    private ForecastSettings settings;

    public DayAdjustment adjust(Item item, LocalDate date) {
        double product = 1.0;
        List<String> notes = new ArrayList<>();

        Optional<WeatherConditions> weather = weather(date, true);
        if (weather.isPresent()) {
            double factor = weatherFactor(item, weather.get());
            if (factor != 1.0) {
                product *= factor;
                notes.add(String.format(Locale.ROOT, "%s weather %s", date, formatPct(factor)));
            }
        }

        for (AdjustmentSignal signal : calendarSignals(date)) {
            double effective = signal.effectiveMultiplier();
            product *= effective;
            if (effective != 1.0) {
                notes.add(String.format(Locale.ROOT, "%s %s %s", date, signal.getLabel(), formatPct(effective)));
            }
        }

        double clamped = clamp(product);
        if (clamped != product) {
            logger.debug("Adjustment for item {} on {} clamped from {} to {}",
                    item.getId(), date, product, clamped);
        }
        return new DayAdjustment(date, clamped, Collections.unmodifiableList(notes));
    }

    /**
     * Holiday and event signals for a date, or none when the feed is unavailable.
     */
    public List<AdjustmentSignal> calendarSignals(LocalDate date) {
        try {
            List<AdjustmentSignal> signals = holidayFeed.get(date);
            return signals != null ? signals : List.of();
        } catch (SignalUnavailableException e) {
            logger.warn("Holiday feed unavailable for {}, using neutral adjustment: {}", date, e.getMessage());
            return List.of();
        }
    }

    /**
     * Weather for a date at the configured location. With {@code freshOnly}, readings recorded
     * more than the stale window before the date are ignored.
     */
    public Optional<WeatherConditions> weather(LocalDate date, boolean freshOnly) {
        Optional<WeatherConditions> conditions;
        try {
            conditions = weatherFeed.get(date, settings.getLocation());
        } catch (SignalUnavailableException e) {
            logger.warn("Weather feed unavailable for {}, using neutral adjustment: {}", date, e.getMessage());
            return Optional.empty();
        }
        if (conditions == null || conditions.isEmpty()) {
            return Optional.empty();
        }
        WeatherConditions wc = conditions.get();
        if (freshOnly && wc.getRecordedAt() != null
                && wc.getRecordedAt().toLocalDate().isBefore(date.minusDays(settings.getWeatherStaleDays()))) {
            logger.info("Ignoring stale weather for {} recorded at {}", date, wc.getRecordedAt());
            return Optional.empty();
        }
        return conditions;
    }

    public boolean isHoliday(List<AdjustmentSignal> signals) {
        return signals.stream().anyMatch(s -> s.getKind() == SignalKind.HOLIDAY || s.getMultiplier() > 1.0);
    }

    double weatherFactor(Item item, WeatherConditions weather) {
        double tempCoef = coefficient(item.getTempCoefficient(), settings.getDefaultTempCoefficient());
        double rainCoef = coefficient(item.getRainCoefficient(), settings.getDefaultRainCoefficient());

        double tempFactor = 1.0;
        if (weather.getMaxTemp() != null && tempCoef != 0.0) {
            tempFactor = Math.max(0.0, 1.0 + tempCoef * (weather.getMaxTemp() - settings.getAnchorTemp()) / 10.0);
        }
        double rainFactor = 1.0;
        if (weather.getPrecipitation() != null && rainCoef != 0.0) {
            rainFactor = Math.max(0.0, 1.0 + rainCoef * (weather.getPrecipitation() - settings.getAnchorRain()) / 10.0);
        }
        return tempFactor * rainFactor;
    }

    double clamp(double multiplier) {
        return Math.max(settings.getMinMultiplier(), Math.min(settings.getMaxMultiplier(), multiplier));
    }

    private static double coefficient(BigDecimal itemValue, double fallback) {
        return itemValue != null ? itemValue.doubleValue() : fallback;
    }

    private static String formatPct(double multiplier) {
        long pct = Math.round((multiplier - 1.0) * 100.0);
        return (pct >= 0 ? "+" : "") + pct + "%";
    }
}
