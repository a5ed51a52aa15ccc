package com.bmsedge.forecast.service;

import com.bmsedge.forecast.config.ForecastSettings;
import com.bmsedge.forecast.dto.TrainResult;
import com.bmsedge.forecast.dto.TrainStatus;
import com.bmsedge.forecast.exception.ResourceNotFoundException;
import com.bmsedge.forecast.ml.FeatureBuilder;
import com.bmsedge.forecast.ml.ModelParameters;
import com.bmsedge.forecast.ml.RidgeRegression;
import com.bmsedge.forecast.model.AdjustmentSignal;
import com.bmsedge.forecast.model.ForecastWeek;
import com.bmsedge.forecast.model.Item;
import com.bmsedge.forecast.model.ItemModel;
import com.bmsedge.forecast.model.SaleRecord;
import com.bmsedge.forecast.model.WeatherConditions;
import com.bmsedge.forecast.repository.ItemRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Trains and applies the per-item ridge model.
 */
@Service
public class ItemModelTrainingService {

    private static final Logger logger = LoggerFactory.getLogger(ItemModelTrainingService.class);

    private static final double[] CV_SPLITS = {0.6, 0.75, 0.9};
    private static final int MIN_FOLD_TRAIN = 10;
    private static final int MIN_FOLD_TEST = 1;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    private ItemRepository itemRepository;

    @Autowired
    private SalesStore salesStore;

    @Autowired
    private ItemModelStore itemModelStore;

    @Autowired
    private AdjustmentEngine adjustmentEngine;

    @Autowired
    private ForecastSettings settings;

    // ==================== TRAINING ====================

    public TrainResult train(Long itemId) {
        Item item = itemRepository.findById(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Item not found with id: " + itemId));
        return train(item);
    }

    /**
     * Trains every active item that has sales. A failure on one item is reported, not rethrown.
     */
    public List<TrainResult> trainAll() {
        Set<Long> withHistory = new HashSet<>(salesStore.itemIdsWithHistory());
        List<TrainResult> results = new ArrayList<>();
        for (Item item : itemRepository.findActiveItems()) {
            if (!withHistory.contains(item.getId())) continue;
            results.add(trainSafely(item));
        }
        long trained = results.stream().filter(TrainResult::isTrained).count();
        logger.info("Model training finished: {} trained, {} skipped or failed", trained, results.size() - trained);
        return results;
    }

    public List<TrainResult> trainItems(Collection<Long> itemIds) {
        List<TrainResult> results = new ArrayList<>();
        for (Long id : itemIds) {
            Optional<Item> item = itemRepository.findById(id);
            if (item.isPresent()) {
                results.add(trainSafely(item.get()));
            }
        }
        return results;
    }

    private TrainResult trainSafely(Item item) {
        try {
            return train(item);
        } catch (RuntimeException e) {
            logger.warn("Training failed for item '{}' (id={}): {}", item.getCanonicalName(), item.getId(), e.getMessage());
            return TrainResult.builder()
                    .itemId(item.getId())
                    .itemName(item.getCanonicalName())
                    .status(TrainStatus.FAILED)
                    .message(e.getMessage())
                    .build();
        }
    }

    TrainResult train(Item item) {
        List<Sample> samples = loadSamples(item.getId());

        if (samples.size() < settings.getMinTrainingSamples()) {
            logger.info("Item '{}' has {} labeled days, {} required; no model trained",
                    item.getCanonicalName(), samples.size(), settings.getMinTrainingSamples());
            if (itemModelStore.delete(item.getId())) {
                logger.warn("Dropped the previous model of '{}'; its history no longer meets the minimum",
                        item.getCanonicalName());
            }
            return TrainResult.builder()
                    .itemId(item.getId())
                    .itemName(item.getCanonicalName())
                    .status(TrainStatus.INSUFFICIENT_HISTORY)
                    .trainingSamples(samples.size())
                    .message("Needs at least " + settings.getMinTrainingSamples() + " days of sales")
                    .build();
        }

        Double cvError = crossValidate(samples);
        boolean lowConfidence = cvError != null && cvError > settings.getMaxCvMape();

        ModelParameters params = fit(samples);
        ItemModel model = new ItemModel();
        model.setItemId(item.getId());
        model.setAlgorithmTag(RidgeRegression.ALGORITHM_TAG);
        model.setSerializedParameters(serialize(params));
        model.setFeatureSchema(serialize(FeatureBuilder.FEATURE_NAMES));
        model.setTrainingSamples(samples.size());
        model.setCrossValError(cvError);
        model.setLowConfidence(lowConfidence);
        model.setTrainedAt(LocalDateTime.now());

        ItemModel saved = itemModelStore.save(model);
        logger.info("Trained model for '{}': {} samples, CV MAPE {}, low confidence {}",
                item.getCanonicalName(), samples.size(),
                cvError != null ? String.format("%.1f%%", cvError) : "n/a", lowConfidence);

        return TrainResult.builder()
                .itemId(item.getId())
                .itemName(item.getCanonicalName())
                .status(TrainStatus.TRAINED)
                .trainingSamples(samples.size())
                .crossValError(cvError)
                .lowConfidence(lowConfidence)
                .version(saved.getVersion())
                .trainedAt(saved.getTrainedAt())
                .message(lowConfidence ? "Model kept but not used for blending (low confidence)" : "Model trained")
                .build();
    }

    /**
     * Rolling-origin validation: fit on the first 60/75/90% in date order, test on the rest.
     *
     * @return mean MAPE in percent across valid folds, or null when no fold qualifies
     */
    Double crossValidate(List<Sample> samples) {
        List<Double> foldErrors = new ArrayList<>();
        int n = samples.size();
        for (double split : CV_SPLITS) {
            int cut = (int) Math.floor(n * split);
            List<Sample> train = samples.subList(0, cut);
            List<Sample> test = samples.subList(cut, n);
            if (train.size() < MIN_FOLD_TRAIN || test.size() < MIN_FOLD_TEST) {
                continue;
            }
            ModelParameters params = fit(train);
            double sum = 0.0;
            for (Sample s : test) {
                double predicted = Math.max(0.0, params.predict(features(s, params)));
                double denominator = s.quantity == 0.0 ? 1.0 : Math.abs(s.quantity);
                sum += Math.abs(s.quantity - predicted) / denominator;
            }
            foldErrors.add(100.0 * sum / test.size());
        }
        if (foldErrors.isEmpty()) {
            return null;
        }
        return foldErrors.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    ModelParameters fit(List<Sample> samples) {
        double medianTemp = median(samples.stream().map(s -> s.maxTemp));
        double medianRain = median(samples.stream().map(s -> s.rainMm));

        double[][] x = new double[samples.size()][];
        double[] y = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            Sample s = samples.get(i);
            x[i] = FeatureBuilder.build(s.date, s.maxTemp, s.rainMm, s.holiday, medianTemp, medianRain);
            y[i] = s.quantity;
        }

        ModelParameters params = RidgeRegression.fit(x, y, settings.getRidgeAlpha());
        params.setFeatureNames(FeatureBuilder.FEATURE_NAMES);
        params.setMedianMaxTemp(medianTemp);
        params.setMedianRainMm(medianRain);
        return params;
    }

    private List<Sample> loadSamples(Long itemId) {
        List<SaleRecord> history = salesStore.history(itemId);
        List<Sample> samples = new ArrayList<>();
        for (SaleRecord record : history) {
            LocalDate date = record.getSaleDate();
            if (!ForecastWeek.isOperatingDay(date)) continue;
            Optional<WeatherConditions> weather = adjustmentEngine.weather(date, false);
            List<AdjustmentSignal> signals = adjustmentEngine.calendarSignals(date);
            samples.add(new Sample(date,
                    weather.map(WeatherConditions::getMaxTemp).orElse(null),
                    weather.map(WeatherConditions::getPrecipitation).orElse(null),
                    adjustmentEngine.isHoliday(signals),
                    record.getQuantity().doubleValue()));
        }
        samples.sort(Comparator.comparing(s -> s.date));
        return samples;
    }

    // ==================== PREDICTION ====================

    /**
     * Model prediction for one date, floored at zero. Empty when the stored parameters cannot be used.
     */
    public Optional<Double> predict(ItemModel model, LocalDate date) {
        ModelParameters params;
        try {
            params = objectMapper.readValue(model.getSerializedParameters(), ModelParameters.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.warn("Cannot decode model v{} for item {}: {}", model.getVersion(), model.getItemId(), e.getMessage());
            return Optional.empty();
        }

        Optional<WeatherConditions> weather = adjustmentEngine.weather(date, true);
        boolean holiday = adjustmentEngine.isHoliday(adjustmentEngine.calendarSignals(date));
        double[] x = FeatureBuilder.build(date,
                weather.map(WeatherConditions::getMaxTemp).orElse(null),
                weather.map(WeatherConditions::getPrecipitation).orElse(null),
                holiday, params.getMedianMaxTemp(), params.getMedianRainMm());
        try {
            double y = params.predict(x);
            if (Double.isNaN(y) || Double.isInfinite(y)) {
                return Optional.empty();
            }
            return Optional.of(Math.max(0.0, y));
        } catch (IllegalArgumentException | NullPointerException e) {
            logger.warn("Model v{} for item {} does not fit the current features: {}",
                    model.getVersion(), model.getItemId(), e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<ItemModel> findModel(Long itemId) {
        return itemModelStore.load(itemId);
    }

    // ==================== HELPERS ====================

    private double[] features(Sample s, ModelParameters params) {
        return FeatureBuilder.build(s.date, s.maxTemp, s.rainMm, s.holiday,
                params.getMedianMaxTemp(), params.getMedianRainMm());
    }

    private static double median(java.util.stream.Stream<Double> values) {
        List<Double> present = values.filter(Objects::nonNull).collect(Collectors.toList());
        if (present.isEmpty()) return 0.0;
        DescriptiveStatistics stats = new DescriptiveStatistics();
        present.forEach(stats::addValue);
        return stats.getPercentile(50);
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize model parameters", e);
        }
    }

    static final class Sample {
        final LocalDate date;
        final Double maxTemp;
        final Double rainMm;
        final boolean holiday;
        final double quantity;

        Sample(LocalDate date, Double maxTemp, Double rainMm, boolean holiday, double quantity) {
            this.date = date;
            this.maxTemp = maxTemp;
            this.rainMm = rainMm;
            this.holiday = holiday;
            this.quantity = quantity;
        }
    }
}
