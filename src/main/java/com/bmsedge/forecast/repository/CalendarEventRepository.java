package com.bmsedge.forecast.repository;

import com.bmsedge.forecast.model.CalendarEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface CalendarEventRepository extends JpaRepository<CalendarEvent, Long> {

    List<CalendarEvent> findByEventDate(LocalDate eventDate);

    @Modifying
    @Query("DELETE FROM CalendarEvent e WHERE e.eventDate BETWEEN :startDate AND :endDate")
    int deleteByDateRange(@Param("startDate") LocalDate startDate, @Param("endDate") LocalDate endDate);
}
