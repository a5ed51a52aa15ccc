package com.bmsedge.forecast.service;

import com.bmsedge.forecast.config.ForecastSettings;
import com.bmsedge.forecast.model.*;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.*;

/**
 * Combines baseline, model and adjustments into final integer quantities.
 *
 * <p>Per day: {@code max(0, (1-a)*baseline + a*model) * multiplier}, raised to the item floor,
 * checked against history, then rounded to the item's unit.
 */
@Service
public class ForecastBlender {

    @Autowired
    private ForecastSettings settings;

    public static void validateAlpha(double alpha) {
        if (Double.isNaN(alpha) || alpha < 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("Alpha must be within [0, 1], got " + alpha);
        }
    }

    /**
     * @param modelPredictions per-day model output; days without an entry use the baseline only
     * @param adjustments      per-day multipliers; missing days are neutral
     * @param weeklyHistory    past Mon..Sat weekly totals of the item, used for the line note
     */
    public ItemForecast blend(Item item, LocalDate weekStart,
                              Map<DayOfWeek, WeekdayBaseline> baselines,
                              Map<DayOfWeek, Double> modelPredictions,
                              Map<DayOfWeek, DayAdjustment> adjustments,
                              double alpha,
                              List<Double> weeklyHistory) {
        validateAlpha(alpha);

        double floor = floorFor(item);
        int unit = item.getEffectiveRoundingUnit();
        Map<DayOfWeek, Integer> quantities = new EnumMap<>(DayOfWeek.class);
        List<ForecastAlert> alerts = new ArrayList<>();
        List<String> adjustmentNotes = new ArrayList<>();
        boolean modelUsed = false;
        boolean coldStart = true;

        for (LocalDate date : ForecastWeek.operatingDates(weekStart)) {
            DayOfWeek day = date.getDayOfWeek();
            WeekdayBaseline baseline = baselines.get(day);
            double baseValue = baseline != null ? baseline.getEstimatedMean() : 0.0;

            Double model = modelPredictions != null ? modelPredictions.get(day) : null;
            double blended;
            if (model != null) {
                blended = Math.max(0.0, (1.0 - alpha) * baseValue + alpha * model);
                modelUsed |= alpha > 0.0;
            } else {
                blended = Math.max(0.0, baseValue);
            }

            DayAdjustment adjustment = adjustments != null ? adjustments.get(day) : null;
            double multiplier = adjustment != null ? adjustment.getMultiplier() : 1.0;
            if (adjustment != null) {
                adjustmentNotes.addAll(adjustment.getNotes());
            }

            double floored = Math.max(blended * multiplier, floor);

            if (baseline == null || baseline.isColdStart()) {
                alerts.add(new ForecastAlert(item.getId(), date, ForecastAlert.NO_HISTORY,
                        "No " + day.name().toLowerCase(Locale.ROOT) + " sales in the lookback window"));
            } else {
                coldStart = false;
                checkDeviation(item, date, baseline, floored).ifPresent(alerts::add);
            }

            quantities.put(day, round(floored, unit, floor));
        }

        int weeklyTotal = quantities.values().stream().mapToInt(Integer::intValue).sum();
        String note = weeklyNote(weeklyTotal, weeklyHistory);
        if (!adjustmentNotes.isEmpty()) {
            note = note + "; " + String.join("; ", new LinkedHashSet<>(adjustmentNotes));
        }
        if (note.length() > 500) {
            note = note.substring(0, 497) + "...";
        }

        ForecastLine line = new ForecastLine(item.getId(), item.getCanonicalName(), quantities,
                modelUsed, coldStart, note);
        return new ItemForecast(line, alerts);
    }

    private Optional<ForecastAlert> checkDeviation(Item item, LocalDate date, WeekdayBaseline baseline, double value) {
        double std = baseline.getHistoricalStdDev();
        if (baseline.getInstanceCount() < 2 || std <= 0.0) {
            return Optional.empty();
        }
        double mean = baseline.getHistoricalMean();
        if (Math.abs(value - mean) > settings.getAlertStdMultiple() * std) {
            return Optional.of(new ForecastAlert(item.getId(), date, ForecastAlert.DEVIATES_FROM_HISTORY,
                    String.format(Locale.ROOT, "forecast %.1f vs history %.1f ± %.1f over %d weeks",
                            value, mean, std, baseline.getInstanceCount())));
        }
        return Optional.empty();
    }

    /**
     * Nearest multiple of {@code unit} (half up), never below the floor.
     */
    static int round(double value, int unit, double floor) {
        BigDecimal step = BigDecimal.valueOf(unit);
        BigDecimal rounded = BigDecimal.valueOf(value)
                .divide(step, 0, RoundingMode.HALF_UP)
                .multiply(step);
        if (rounded.doubleValue() < floor) {
            rounded = BigDecimal.valueOf(floor)
                    .divide(step, 0, RoundingMode.CEILING)
                    .multiply(step);
        }
        return rounded.intValueExact();
    }

    String weeklyNote(int weeklyTotal, List<Double> weeklyHistory) {
        if (weeklyHistory == null || weeklyHistory.isEmpty()) {
            return "No typical week yet";
        }
        DescriptiveStatistics stats = new DescriptiveStatistics();
        weeklyHistory.forEach(stats::addValue);
        double mean = stats.getMean();
        double std = weeklyHistory.size() >= 2 ? stats.getStandardDeviation() : 0.0;
        if (mean <= 0.0) {
            return "No typical week yet";
        }

        double k = settings.getAlertStdMultiple();
        long diffPct = Math.round((weeklyTotal - mean) / mean * 100.0);
        if (std > 0 && weeklyTotal > mean + k * std) {
            return "Higher than usual (+" + diffPct + "%)";
        }
        if (std > 0 && weeklyTotal < Math.max(mean - k * std, 0.0)) {
            return "Lower than usual (" + diffPct + "%)";
        }
        return "As expected";
    }

    private double floorFor(Item item) {
        if (item.getMinBatchSize() != null && item.getMinBatchSize() >= 0) {
            return item.getMinBatchSize();
        }
        return Math.max(0, settings.getDefaultMinBatchSize());
    }
}
