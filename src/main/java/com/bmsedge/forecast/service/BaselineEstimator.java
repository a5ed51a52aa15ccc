package com.bmsedge.forecast.service;

import com.bmsedge.forecast.config.ForecastSettings;
import com.bmsedge.forecast.model.ForecastWeek;
import com.bmsedge.forecast.model.SaleRecord;
import com.bmsedge.forecast.model.WeekdayBaseline;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Recency-weighted weekday baselines. Instance i steps back from the most recent weighs decay^i.
 */
@Service
public class BaselineEstimator {

    @Autowired
    private ForecastSettings settings;

    @Autowired
    private SalesStore salesStore;

    /**
     * Reads the item's lookback window from the store and estimates Mon..Sat baselines.
     */
    public Map<DayOfWeek, WeekdayBaseline> estimate(Long itemId, LocalDate weekStart) {
        return estimate(itemId, loadHistory(itemId, weekStart), weekStart);
    }

    public List<SaleRecord> loadHistory(Long itemId, LocalDate weekStart) {
        LocalDate from = weekStart.minusWeeks(settings.getLookbackWeeks());
        return salesStore.query(itemId, from, weekStart.minusDays(1));
    }

    public Map<DayOfWeek, WeekdayBaseline> estimate(Long itemId, List<SaleRecord> history, LocalDate weekStart) {
        return estimate(itemId, history, weekStart, settings.getWindowWeeks(), settings.getDecay());
    }

    public Map<DayOfWeek, WeekdayBaseline> estimate(Long itemId, List<SaleRecord> history, LocalDate weekStart,
                                                    int window, double decay) {
        if (!(decay > 0.0 && decay < 1.0)) {
            throw new IllegalArgumentException("Decay must be strictly between 0 and 1, got " + decay);
        }
        if (window < 1) {
            throw new IllegalArgumentException("Window must be at least 1, got " + window);
        }

        // newest first, Mon..Sat only, strictly before the forecast week
        List<SaleRecord> usable = history.stream()
                .filter(r -> r.getSaleDate().isBefore(weekStart))
                .filter(r -> ForecastWeek.isOperatingDay(r.getSaleDate()))
                .sorted(Comparator.comparing(SaleRecord::getSaleDate).reversed())
                .collect(Collectors.toList());

        LocalDateTime now = LocalDateTime.now();
        Map<DayOfWeek, WeekdayBaseline> baselines = new EnumMap<>(DayOfWeek.class);
        Double agnosticMean = null;

        for (DayOfWeek day : ForecastWeek.OPERATING_DAYS) {
            List<Double> instances = usable.stream()
                    .filter(r -> r.getSaleDate().getDayOfWeek() == day)
                    .limit(window)
                    .map(r -> r.getQuantity().doubleValue())
                    .collect(Collectors.toList());

            WeekdayBaseline.WeekdayBaselineBuilder builder = WeekdayBaseline.builder()
                    .itemId(itemId)
                    .weekday(day)
                    .instanceCount(instances.size())
                    .lastUpdated(now);

            if (instances.isEmpty()) {
                baselines.put(day, builder.estimatedMean(0.0).sampleWeight(0.0).fallback(false)
                        .historicalMean(0.0).historicalStdDev(0.0).build());
                continue;
            }

            double sampleWeight = sumOfWeights(instances.size(), decay);
            DescriptiveStatistics stats = new DescriptiveStatistics();
            instances.forEach(stats::addValue);

            double mean;
            boolean fallback = false;
            if (instances.size() < 2) {
                if (agnosticMean == null) {
                    List<Double> all = usable.stream()
                            .limit((long) window * ForecastWeek.OPERATING_DAYS.size())
                            .map(r -> r.getQuantity().doubleValue())
                            .collect(Collectors.toList());
                    agnosticMean = weightedMean(all, decay);
                }
                mean = agnosticMean;
                fallback = true;
            } else {
                mean = weightedMean(instances, decay);
            }

            baselines.put(day, builder
                    .estimatedMean(mean)
                    .sampleWeight(sampleWeight)
                    .fallback(fallback)
                    .historicalMean(stats.getMean())
                    .historicalStdDev(instances.size() >= 2 ? stats.getStandardDeviation() : 0.0)
                    .build());
        }
        return baselines;
    }

    /**
     * Mon..Sat totals of the most recent weeks before {@code weekStart} that had sales, newest first.
     */
    public List<Double> weeklyTotals(List<SaleRecord> history, LocalDate weekStart, int maxWeeks) {
        Map<LocalDate, Double> byWeek = new TreeMap<>(Comparator.reverseOrder());
        for (SaleRecord record : history) {
            LocalDate date = record.getSaleDate();
            if (!date.isBefore(weekStart) || !ForecastWeek.isOperatingDay(date)) continue;
            LocalDate monday = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            byWeek.merge(monday, record.getQuantity().doubleValue(), Double::sum);
        }
        return byWeek.values().stream().limit(maxWeeks).collect(Collectors.toList());
    }

    static double weightedMean(List<Double> newestFirst, double decay) {
        if (newestFirst.isEmpty()) return 0.0;
        double weighted = 0.0;
        double weight = 1.0;
        double total = 0.0;
        for (Double q : newestFirst) {
            weighted += weight * q;
            total += weight;
            weight *= decay;
        }
        return weighted / total;
    }

    private static double sumOfWeights(int n, double decay) {
        double total = 0.0;
        double weight = 1.0;
        for (int i = 0; i < n; i++) {
            total += weight;
            weight *= decay;
        }
        return total;
    }
}
