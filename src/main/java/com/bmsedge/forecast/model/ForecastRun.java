package com.bmsedge.forecast.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One forecast generation event. Rows are written once and never updated.
 */
@Getter
@Entity
@Immutable
@Table(name = "forecast_runs",
        indexes = @Index(name = "idx_forecast_runs_week", columnList = "week_start_date, created_at"))
public class ForecastRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "week_start_date", nullable = false)
    private LocalDate weekStartDate;

    @Column(name = "alpha", precision = 4, scale = 3)
    private BigDecimal alpha;

    @Column(name = "use_model")
    private Boolean useModel;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @OneToMany(mappedBy = "run", cascade = CascadeType.PERSIST)
    @OrderBy("itemName ASC")
    private List<ForecastLine> lines = new ArrayList<>();

    @OneToMany(mappedBy = "run", cascade = CascadeType.PERSIST)
    @OrderBy("id ASC")
    private List<ForecastAlert> alerts = new ArrayList<>();

    protected ForecastRun() {}

    public ForecastRun(LocalDate weekStartDate, BigDecimal alpha, boolean useModel, LocalDateTime createdAt) {
        this.weekStartDate = weekStartDate;
        this.alpha = alpha;
        this.useModel = useModel;
        this.createdAt = createdAt;
    }

    public void addLine(ForecastLine line) {
        line.attachTo(this);
        lines.add(line);
    }

    public void addAlert(ForecastAlert alert) {
        alert.attachTo(this);
        alerts.add(alert);
    }

    public List<ForecastLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public List<ForecastAlert> getAlerts() {
        return Collections.unmodifiableList(alerts);
    }
}
