package com.bmsedge.forecast.repository;

import com.bmsedge.forecast.model.ForecastRun;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface ForecastRunRepository extends JpaRepository<ForecastRun, Long> {

    @Query("SELECT r FROM ForecastRun r WHERE r.weekStartDate = :week ORDER BY r.createdAt DESC, r.id DESC")
    List<ForecastRun> findByWeekNewestFirst(@Param("week") LocalDate weekStartDate);

    Optional<ForecastRun> findFirstByWeekStartDateOrderByCreatedAtDescIdDesc(LocalDate weekStartDate);

    Optional<ForecastRun> findFirstByOrderByCreatedAtDescIdDesc();

    @Query("SELECT r FROM ForecastRun r ORDER BY r.createdAt DESC, r.id DESC")
    Page<ForecastRun> findRecent(Pageable pageable);
}
