package com.bmsedge.forecast.service;

import com.bmsedge.forecast.config.ForecastSettings;
import com.bmsedge.forecast.dto.ForecastAlertResponse;
import com.bmsedge.forecast.dto.ForecastLineResponse;
import com.bmsedge.forecast.dto.ForecastRunResponse;
import com.bmsedge.forecast.dto.ForecastRunSummary;
import com.bmsedge.forecast.exception.HistoryNotReadyException;
import com.bmsedge.forecast.exception.PersistenceFailureException;
import com.bmsedge.forecast.exception.ResourceNotFoundException;
import com.bmsedge.forecast.model.*;
import com.bmsedge.forecast.repository.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Produces and reads weekly forecast runs.
 */
@Service
public class ForecastService {

    private static final Logger logger = LoggerFactory.getLogger(ForecastService.class);

    @Autowired
    private ItemRepository itemRepository;

    @Autowired
    private SalesStore salesStore;

    @Autowired
    private BaselineEstimator baselineEstimator;

    @Autowired
    private AdjustmentEngine adjustmentEngine;

    @Autowired
    private ItemModelTrainingService modelTrainingService;

    @Autowired
    private ForecastBlender forecastBlender;

    @Autowired
    private ForecastRunRecorder forecastRunRecorder;

    @Autowired
    private ForecastSettings settings;

    /**
     * Forecasts Mon..Sat of {@code weekStart} for every active item and records the run.
     * Items are computed independently; one failing item does not stop the run.
     */
    @Transactional
    public ForecastRunResponse forecast(LocalDate weekStart, double alpha, boolean useModel) {
        if (weekStart == null) {
            weekStart = ForecastWeek.nextMonday(LocalDate.now());
        }
        if (weekStart.getDayOfWeek() != DayOfWeek.MONDAY) {
            throw new IllegalArgumentException("Week start must be a Monday: " + weekStart);
        }
        ForecastBlender.validateAlpha(alpha);
        checkReadiness(weekStart);

        List<Item> items = itemRepository.findActiveItems();
        logger.info("Forecasting week {} for {} items (alpha={}, useModel={})",
                weekStart, items.size(), alpha, useModel);

        List<ItemForecast> results = new ArrayList<>(items.size());
        for (Item item : items) {
            try {
                results.add(forecastItem(item, weekStart, alpha, useModel));
            } catch (PersistenceFailureException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.warn("Forecast failed for item '{}' (id={}): {}",
                        item.getCanonicalName(), item.getId(), e.getMessage(), e);
                Map<DayOfWeek, Integer> zeros = new EnumMap<>(DayOfWeek.class);
                ForecastLine line = new ForecastLine(item.getId(), item.getCanonicalName(), zeros,
                        false, false, "Forecast unavailable");
                results.add(new ItemForecast(line, List.of(new ForecastAlert(item.getId(), weekStart,
                        ForecastAlert.ITEM_FAILED, truncate(e.getMessage())))));
            }
        }

        ForecastRun run = forecastRunRecorder.record(weekStart, alpha, useModel, results);
        return convertToResponse(run);
    }

    ItemForecast forecastItem(Item item, LocalDate weekStart, double alpha, boolean useModel) {
        List<SaleRecord> history = baselineEstimator.loadHistory(item.getId(), weekStart);
        Map<DayOfWeek, WeekdayBaseline> baselines = baselineEstimator.estimate(item.getId(), history, weekStart);

        Map<DayOfWeek, DayAdjustment> adjustments = new EnumMap<>(DayOfWeek.class);
        for (LocalDate date : ForecastWeek.operatingDates(weekStart)) {
            adjustments.put(date.getDayOfWeek(), adjustmentEngine.adjust(item, date));
        }

        List<ForecastAlert> modelAlerts = new ArrayList<>();
        Map<DayOfWeek, Double> predictions = useModel && alpha > 0.0
                ? modelPredictions(item, weekStart, modelAlerts)
                : Collections.emptyMap();

        List<Double> weeklyHistory = baselineEstimator.weeklyTotals(history, weekStart, settings.getLookbackWeeks());
        ItemForecast blended = forecastBlender.blend(item, weekStart, baselines, predictions, adjustments,
                alpha, weeklyHistory);

        if (modelAlerts.isEmpty()) {
            return blended;
        }
        List<ForecastAlert> alerts = new ArrayList<>(modelAlerts);
        alerts.addAll(blended.getAlerts());
        return new ItemForecast(blended.getLine(), alerts);
    }

    /**
     * Per-day predictions when the item has a usable model. A failed day drops the model for the
     * whole week so the line is blended consistently.
     */
    private Map<DayOfWeek, Double> modelPredictions(Item item, LocalDate weekStart, List<ForecastAlert> alerts) {
        Optional<ItemModel> model;
        try {
            model = modelTrainingService.findModel(item.getId());
        } catch (PersistenceFailureException e) {
            logger.warn("Model store unavailable for item {}: {}", item.getId(), e.getMessage());
            alerts.add(new ForecastAlert(item.getId(), weekStart, ForecastAlert.MODEL_UNAVAILABLE, "Model store unavailable"));
            return Collections.emptyMap();
        }
        if (model.isEmpty() || model.get().isLowConfidence()) {
            return Collections.emptyMap();
        }
        Integer samples = model.get().getTrainingSamples();
        if (samples == null || samples < settings.getMinTrainingSamples()) {
            logger.info("Skipping model v{} for item {}: trained on {} samples, {} required",
                    model.get().getVersion(), item.getId(), samples, settings.getMinTrainingSamples());
            return Collections.emptyMap();
        }

        Map<DayOfWeek, Double> predictions = new EnumMap<>(DayOfWeek.class);
        for (LocalDate date : ForecastWeek.operatingDates(weekStart)) {
            Optional<Double> prediction = modelTrainingService.predict(model.get(), date);
            if (prediction.isEmpty()) {
                alerts.add(new ForecastAlert(item.getId(), date, ForecastAlert.MODEL_UNAVAILABLE,
                        "Model v" + model.get().getVersion() + " could not predict; baseline used"));
                return Collections.emptyMap();
            }
            predictions.put(date.getDayOfWeek(), prediction.get());
        }
        return predictions;
    }

    void checkReadiness(LocalDate weekStart) {
        if (!settings.isEnforceReadiness()) {
            return;
        }
        Optional<LocalDate> latest = salesStore.latestSaleDateBefore(weekStart);
        if (latest.isEmpty()) {
            throw new HistoryNotReadyException("No committed sales history before " + weekStart
                    + ". Upload sales before forecasting.");
        }
        LocalDate oldestAllowed = weekStart.minusDays(settings.getMaxStalenessDays());
        if (latest.get().isBefore(oldestAllowed)) {
            throw new HistoryNotReadyException("Latest committed sale is " + latest.get()
                    + "; sales up to at least " + oldestAllowed + " are needed to forecast week " + weekStart);
        }
    }

    // ==================== READS ====================

    @Transactional(readOnly = true)
    public List<ForecastRunResponse> getRunsForWeek(LocalDate weekStart) {
        return forecastRunRecorder.runsForWeek(weekStart).stream()
                .map(this::convertToResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ForecastRunResponse getLatestRun(LocalDate weekStart) {
        Optional<ForecastRun> run = weekStart != null
                ? forecastRunRecorder.latestForWeek(weekStart)
                : forecastRunRecorder.latest();
        return run.map(this::convertToResponse)
                .orElseThrow(() -> new ResourceNotFoundException(weekStart != null
                        ? "No forecast run for week " + weekStart
                        : "No forecast runs recorded yet"));
    }

    @Transactional(readOnly = true)
    public ForecastRunResponse getRun(Long runId) {
        return convertToResponse(forecastRunRecorder.getRun(runId));
    }

    @Transactional(readOnly = true)
    public Page<ForecastRunSummary> getHistory(int page, int size) {
        return forecastRunRecorder.recentRuns(page, size).map(this::convertToSummary);
    }

    // ==================== MAPPING ====================

    private ForecastRunResponse convertToResponse(ForecastRun run) {
        ForecastRunResponse response = new ForecastRunResponse();
        response.setRunId(run.getId());
        response.setWeekStartDate(run.getWeekStartDate());
        response.setAlpha(run.getAlpha());
        response.setUseModel(run.getUseModel());
        response.setCreatedAt(run.getCreatedAt());

        Map<Long, String> names = new HashMap<>();
        int total = 0;
        for (ForecastLine line : run.getLines()) {
            ForecastLineResponse lr = new ForecastLineResponse();
            lr.setItemId(line.getItemId());
            lr.setItemName(line.getItemName());
            lr.setMon(line.getMon());
            lr.setTue(line.getTue());
            lr.setWed(line.getWed());
            lr.setThu(line.getThu());
            lr.setFri(line.getFri());
            lr.setSat(line.getSat());
            lr.setWeeklyTotal(line.getWeeklyTotal());
            lr.setModelUsed(line.getModelUsed());
            lr.setColdStart(line.getColdStart());
            lr.setNote(line.getNote());
            response.getLines().add(lr);
            names.put(line.getItemId(), line.getItemName());
            total += line.getWeeklyTotal() != null ? line.getWeeklyTotal() : 0;
        }
        response.setTotalQuantity(total);

        for (ForecastAlert alert : run.getAlerts()) {
            ForecastAlertResponse ar = new ForecastAlertResponse();
            ar.setItemId(alert.getItemId());
            ar.setItemName(names.get(alert.getItemId()));
            ar.setForecastDate(alert.getForecastDate());
            ar.setReason(alert.getReason());
            ar.setDetail(alert.getDetail());
            response.getAlerts().add(ar);
        }
        return response;
    }

    private ForecastRunSummary convertToSummary(ForecastRun run) {
        ForecastRunSummary summary = new ForecastRunSummary();
        summary.setRunId(run.getId());
        summary.setWeekStartDate(run.getWeekStartDate());
        summary.setCreatedAt(run.getCreatedAt());
        summary.setAlpha(run.getAlpha());
        summary.setUseModel(run.getUseModel());
        summary.setItemCount(run.getLines().size());
        summary.setAlertCount(run.getAlerts().size());
        summary.setTotalQuantity(run.getLines().stream()
                .mapToInt(l -> l.getWeeklyTotal() != null ? l.getWeeklyTotal() : 0)
                .sum());
        return summary;
    }

    private static String truncate(String message) {
        if (message == null) return null;
        return message.length() <= 500 ? message : message.substring(0, 497) + "...";
    }
}
