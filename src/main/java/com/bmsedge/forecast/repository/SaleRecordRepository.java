package com.bmsedge.forecast.repository;

import com.bmsedge.forecast.model.SaleRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SaleRecordRepository extends JpaRepository<SaleRecord, Long> {

    /**
     * Existing rows for the (item, date) keys of a batch.
     */
    @Query("SELECT s FROM SaleRecord s WHERE s.itemId IN :itemIds " +
            "AND s.saleDate BETWEEN :startDate AND :endDate")
    List<SaleRecord> findByItemIdsAndDateRange(@Param("itemIds") Collection<Long> itemIds,
                                               @Param("startDate") LocalDate startDate,
                                               @Param("endDate") LocalDate endDate);

    @Query("SELECT s FROM SaleRecord s WHERE s.itemId = :itemId " +
            "AND s.saleDate BETWEEN :startDate AND :endDate ORDER BY s.saleDate")
    List<SaleRecord> findByItemIdAndDateRange(@Param("itemId") Long itemId,
                                              @Param("startDate") LocalDate startDate,
                                              @Param("endDate") LocalDate endDate);

    List<SaleRecord> findByItemIdOrderBySaleDateAsc(Long itemId);

    @Query("SELECT MAX(s.saleDate) FROM SaleRecord s WHERE s.saleDate < :before")
    Optional<LocalDate> findLatestSaleDateBefore(@Param("before") LocalDate before);

    @Query("SELECT DISTINCT s.itemId FROM SaleRecord s")
    List<Long> findDistinctItemIds();
}
