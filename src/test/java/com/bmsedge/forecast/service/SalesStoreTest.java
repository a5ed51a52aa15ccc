package com.bmsedge.forecast.service;

import com.bmsedge.forecast.exception.PersistenceFailureException;
import com.bmsedge.forecast.model.CanonicalSale;
import com.bmsedge.forecast.model.SaleRecord;
import com.bmsedge.forecast.repository.SaleRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

class SalesStoreTest {

    private static final LocalDate DAY = LocalDate.of(2025, 4, 14);

    @Mock
    private SaleRecordRepository saleRecordRepository;

    @InjectMocks
    private SalesStore salesStore;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(saleRecordRepository.findByItemIdsAndDateRange(anyCollection(), any(), any())).thenReturn(List.of());
    }

    private List<SaleRecord> captureSaved() {
        ArgumentCaptor<List<SaleRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(saleRecordRepository).saveAll(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("Sales for the same item and date within a batch are summed")
    void testDuplicatesSummed() {
        // Arrange
        List<CanonicalSale> sales = List.of(
                new CanonicalSale(DAY, 1L, new BigDecimal("3"), "row 2"),
                new CanonicalSale(DAY, 1L, new BigDecimal("4"), "row 5"),
                new CanonicalSale(DAY, 2L, new BigDecimal("1"), "row 3"));

        // Act
        int written = salesStore.append(sales, 10L);

        // Assert
        assertEquals(2, written);
        List<SaleRecord> saved = captureSaved();
        SaleRecord first = saved.stream().filter(r -> r.getItemId() == 1L).findFirst().orElseThrow();
        assertEquals(0, new BigDecimal("7").compareTo(first.getQuantity()));
        assertEquals("row 2; row 5", first.getSourceRowRef());
        assertEquals(10L, first.getBatchId());
    }

    @Test
    @DisplayName("Re-ingesting a stored day replaces the value instead of doubling it")
    void testReingestReplaces() {
        SaleRecord stored = new SaleRecord(1L, DAY, new BigDecimal("5"));
        stored.setId(42L);
        when(saleRecordRepository.findByItemIdsAndDateRange(anyCollection(), eq(DAY), eq(DAY)))
                .thenReturn(List.of(stored));

        salesStore.append(List.of(new CanonicalSale(DAY, 1L, new BigDecimal("5"), "row 2")), 11L);

        List<SaleRecord> saved = captureSaved();
        assertEquals(1, saved.size());
        assertSame(stored, saved.get(0));
        assertEquals(0, new BigDecimal("5").compareTo(saved.get(0).getQuantity()));
        assertEquals(11L, saved.get(0).getBatchId());
    }

    @Test
    @DisplayName("Refunds net against sales of the same day")
    void testRefundNets() {
        salesStore.append(List.of(
                new CanonicalSale(DAY, 1L, new BigDecimal("5"), null),
                new CanonicalSale(DAY, 1L, new BigDecimal("-2"), null)));

        assertEquals(0, new BigDecimal("3").compareTo(captureSaved().get(0).getQuantity()));
    }

    @Test
    @DisplayName("An empty batch writes nothing")
    void testEmptyBatch() {
        assertEquals(0, salesStore.append(List.of()));
        verify(saleRecordRepository, never()).saveAll(any());
    }

    @Test
    @DisplayName("Storage errors surface as persistence failures")
    void testStorageFailure() {
        when(saleRecordRepository.saveAll(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThrows(PersistenceFailureException.class, () -> salesStore.append(List.of(
                new CanonicalSale(DAY, 1L, BigDecimal.ONE, null))));
    }
}
