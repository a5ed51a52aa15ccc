package com.bmsedge.forecast.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Holiday or local event that lifts (or depresses) demand on a date.
 */
@Getter
@Setter
@Entity
@Table(name = "calendar_events",
        indexes = @Index(name = "idx_calendar_events_date", columnList = "event_date"))
public class CalendarEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "event_date", nullable = false)
    private LocalDate eventDate;

    @NotBlank
    @Column(name = "event_name", nullable = false, length = 200)
    private String eventName;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", length = 20)
    private SignalKind kind = SignalKind.EVENT;

    @Column(name = "uplift_pct", precision = 8, scale = 2)
    private BigDecimal upliftPct = BigDecimal.ZERO;

    /** Confidence in the uplift, 0..1. */
    @Column(name = "weight", precision = 4, scale = 3)
    private BigDecimal weight = BigDecimal.ONE;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
