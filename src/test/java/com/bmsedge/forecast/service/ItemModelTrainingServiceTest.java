package com.bmsedge.forecast.service;

import com.bmsedge.forecast.config.ForecastSettings;
import com.bmsedge.forecast.dto.TrainResult;
import com.bmsedge.forecast.dto.TrainStatus;
import com.bmsedge.forecast.exception.ResourceNotFoundException;
import com.bmsedge.forecast.ml.ModelParameters;
import com.bmsedge.forecast.ml.RidgeRegression;
import com.bmsedge.forecast.model.Item;
import com.bmsedge.forecast.model.ItemModel;
import com.bmsedge.forecast.model.SaleRecord;
import com.bmsedge.forecast.repository.ItemRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.Spy;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.*;

class ItemModelTrainingServiceTest {

    private static final LocalDate FIRST_MONDAY = LocalDate.of(2025, 1, 6);

    @Mock
    private ItemRepository itemRepository;

    @Mock
    private SalesStore salesStore;

    @Mock
    private ItemModelStore itemModelStore;

    @Mock
    private AdjustmentEngine adjustmentEngine;

    @Spy
    private ForecastSettings settings = new ForecastSettings();

    @InjectMocks
    private ItemModelTrainingService trainingService;

    private Item item;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        item = new Item("Croissant");
        item.setId(1L);
        when(itemRepository.findById(1L)).thenReturn(Optional.of(item));
        when(adjustmentEngine.weather(any(LocalDate.class), anyBoolean())).thenReturn(Optional.empty());
        when(adjustmentEngine.calendarSignals(any(LocalDate.class))).thenReturn(List.of());
        when(itemModelStore.save(any(ItemModel.class))).thenAnswer(invocation -> {
            ItemModel model = invocation.getArgument(0);
            model.setVersion(1);
            return model;
        });
    }

    /** Mon..Sat sales of 20 + 5 * dayIndex, skipping Sundays. */
    private static List<SaleRecord> weekdayPattern(int operatingDays) {
        List<SaleRecord> records = new ArrayList<>();
        LocalDate date = FIRST_MONDAY;
        while (records.size() < operatingDays) {
            if (date.getDayOfWeek() != DayOfWeek.SUNDAY) {
                int qty = 20 + 5 * (date.getDayOfWeek().getValue() - 1);
                records.add(new SaleRecord(1L, date, BigDecimal.valueOf(qty)));
            }
            date = date.plusDays(1);
        }
        return records;
    }

    @Test
    @DisplayName("Too little history reports insufficient history and stores nothing")
    void testInsufficientHistory() {
        // Arrange
        when(salesStore.history(1L)).thenReturn(weekdayPattern(15));

        // Act
        TrainResult result = trainingService.train(1L);

        // Assert
        assertEquals(TrainStatus.INSUFFICIENT_HISTORY, result.getStatus());
        assertEquals(15, result.getTrainingSamples());
        verify(itemModelStore, never()).save(any());
    }

    @Test
    @DisplayName("A model left over from richer history is removed once the minimum is no longer met")
    void testInsufficientHistoryRemovesStoredModel() {
        // Arrange
        settings.setMinTrainingSamples(30);
        when(salesStore.history(1L)).thenReturn(weekdayPattern(25));
        when(itemModelStore.delete(1L)).thenReturn(true);

        // Act
        TrainResult result = trainingService.train(1L);

        // Assert
        assertEquals(TrainStatus.INSUFFICIENT_HISTORY, result.getStatus());
        verify(itemModelStore).delete(1L);
        verify(itemModelStore, never()).save(any());
    }

    @Test
    @DisplayName("Sunday sales are not used as training samples")
    void testSundaysExcluded() {
        List<SaleRecord> history = new ArrayList<>(weekdayPattern(19));
        history.add(new SaleRecord(1L, LocalDate.of(2025, 1, 12), BigDecimal.TEN));

        when(salesStore.history(1L)).thenReturn(history);

        TrainResult result = trainingService.train(1L);

        assertEquals(TrainStatus.INSUFFICIENT_HISTORY, result.getStatus());
        assertEquals(19, result.getTrainingSamples());
    }

    @Test
    @DisplayName("A stable weekday pattern trains a confident model that reproduces it")
    void testTrainAndPredict() {
        // Arrange
        when(salesStore.history(1L)).thenReturn(weekdayPattern(60));

        // Act
        TrainResult result = trainingService.train(1L);

        // Assert
        assertEquals(TrainStatus.TRAINED, result.getStatus());
        assertEquals(60, result.getTrainingSamples());
        assertNotNull(result.getCrossValError());
        assertFalse(result.isLowConfidence());

        ArgumentCaptor<ItemModel> captor = ArgumentCaptor.forClass(ItemModel.class);
        verify(itemModelStore).save(captor.capture());
        ItemModel saved = captor.getValue();
        assertEquals(RidgeRegression.ALGORITHM_TAG, saved.getAlgorithmTag());
        assertEquals(1L, saved.getItemId());

        Optional<Double> saturday = trainingService.predict(saved, LocalDate.of(2025, 3, 15));
        assertTrue(saturday.isPresent());
        assertTrue(saturday.get() > 42.0 && saturday.get() < 48.0,
                "Saturday prediction was " + saturday.get());

        Optional<Double> monday = trainingService.predict(saved, LocalDate.of(2025, 3, 17));
        assertTrue(monday.isPresent());
        assertTrue(monday.get() > 17.0 && monday.get() < 23.0, "Monday prediction was " + monday.get());
    }

    @Test
    @DisplayName("A high cross-validation error keeps the model but flags it")
    void testLowConfidenceFlag() {
        settings.setMaxCvMape(0.0);
        List<SaleRecord> history = weekdayPattern(60);
        // noise so no fold is perfect
        for (int i = 0; i < history.size(); i += 3) {
            SaleRecord r = history.get(i);
            r.setQuantity(r.getQuantity().add(BigDecimal.valueOf(7)));
        }
        when(salesStore.history(1L)).thenReturn(history);

        TrainResult result = trainingService.train(1L);

        assertEquals(TrainStatus.TRAINED, result.getStatus());
        assertTrue(result.isLowConfidence());
        verify(itemModelStore).save(argThat(ItemModel::isLowConfidence));
    }

    @Test
    @DisplayName("Cross-validation is skipped when no fold has enough training rows")
    void testCrossValidationNeedsEnoughRows() {
        List<ItemModelTrainingService.Sample> samples = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            LocalDate date = FIRST_MONDAY.plusDays(i);
            samples.add(new ItemModelTrainingService.Sample(date, null, null, false, 10.0));
        }

        assertNull(trainingService.crossValidate(samples));
    }

    @Test
    @DisplayName("Unknown item fails with not found")
    void testTrainUnknownItem() {
        when(itemRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> trainingService.train(99L));
    }

    @Test
    @DisplayName("Training all items reports a failing item instead of aborting")
    void testTrainAllContinuesAfterFailure() {
        Item other = new Item("Muffin");
        other.setId(2L);
        when(itemRepository.findActiveItems()).thenReturn(List.of(item, other));
        when(salesStore.itemIdsWithHistory()).thenReturn(List.of(1L, 2L));
        when(salesStore.history(1L)).thenThrow(new IllegalStateException("boom"));
        when(salesStore.history(2L)).thenReturn(weekdayPattern(60));

        List<TrainResult> results = trainingService.trainAll();

        assertEquals(2, results.size());
        assertEquals(TrainStatus.FAILED, results.get(0).getStatus());
        assertEquals(TrainStatus.TRAINED, results.get(1).getStatus());
    }

    @Test
    @DisplayName("Undecodable or mismatched parameters give no prediction")
    void testUnusableModelGivesNoPrediction() throws Exception {
        ItemModel corrupt = new ItemModel();
        corrupt.setItemId(1L);
        corrupt.setSerializedParameters("{not json");

        assertTrue(trainingService.predict(corrupt, LocalDate.of(2025, 3, 15)).isEmpty());

        ModelParameters narrow = RidgeRegression.fit(
                new double[][]{{1, 2, 3}, {2, 3, 4}, {3, 5, 1}}, new double[]{1, 2, 3}, 1.0);
        ItemModel mismatched = new ItemModel();
        mismatched.setItemId(1L);
        mismatched.setSerializedParameters(new ObjectMapper().writeValueAsString(narrow));

        assertTrue(trainingService.predict(mismatched, LocalDate.of(2025, 3, 15)).isEmpty());
    }
}
