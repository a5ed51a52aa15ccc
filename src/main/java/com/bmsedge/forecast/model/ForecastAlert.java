package com.bmsedge.forecast.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.Immutable;

import java.time.LocalDate;

/**
 * Advisory finding attached to a run. Never changes the forecast values.
 */
@Getter
@Entity
@Immutable
@Table(name = "forecast_alerts",
        indexes = @Index(name = "idx_forecast_alerts_run", columnList = "run_id"))
public class ForecastAlert {

    public static final String DEVIATES_FROM_HISTORY = "deviates from history";
    public static final String NO_HISTORY = "no history for weekday";
    public static final String MODEL_UNAVAILABLE = "model prediction unavailable";
    public static final String ITEM_FAILED = "forecast failed for item";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id", nullable = false)
    private ForecastRun run;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(name = "forecast_date", nullable = false)
    private LocalDate forecastDate;

    @Column(name = "reason", nullable = false, length = 100)
    private String reason;

    @Column(name = "detail", length = 500)
    private String detail;

    protected ForecastAlert() {}

    public ForecastAlert(Long itemId, LocalDate forecastDate, String reason, String detail) {
        this.itemId = itemId;
        this.forecastDate = forecastDate;
        this.reason = reason;
        this.detail = detail;
    }

    void attachTo(ForecastRun run) {
        this.run = run;
    }
}
