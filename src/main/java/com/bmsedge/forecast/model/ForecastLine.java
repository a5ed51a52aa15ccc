package com.bmsedge.forecast.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.Immutable;

import java.time.DayOfWeek;
import java.util.Map;

/**
 * Final Mon..Sat quantities of one item inside a run.
 */
@Getter
@Entity
@Immutable
@Table(name = "forecast_lines",
        indexes = @Index(name = "idx_forecast_lines_run", columnList = "run_id"))
public class ForecastLine {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id", nullable = false)
    private ForecastRun run;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    // Name snapshot so history stays readable after renames
    @Column(name = "item_name", nullable = false, length = 200)
    private String itemName;

    @Column(name = "mon") private Integer mon;
    @Column(name = "tue") private Integer tue;
    @Column(name = "wed") private Integer wed;
    @Column(name = "thu") private Integer thu;
    @Column(name = "fri") private Integer fri;
    @Column(name = "sat") private Integer sat;

    @Column(name = "weekly_total")
    private Integer weeklyTotal;

    @Column(name = "model_used")
    private Boolean modelUsed;

    @Column(name = "cold_start")
    private Boolean coldStart;

    @Column(name = "note", length = 500)
    private String note;

    protected ForecastLine() {}

    public ForecastLine(Long itemId, String itemName, Map<DayOfWeek, Integer> quantities,
                        boolean modelUsed, boolean coldStart, String note) {
        this.itemId = itemId;
        this.itemName = itemName;
        this.mon = quantities.getOrDefault(DayOfWeek.MONDAY, 0);
        this.tue = quantities.getOrDefault(DayOfWeek.TUESDAY, 0);
        this.wed = quantities.getOrDefault(DayOfWeek.WEDNESDAY, 0);
        this.thu = quantities.getOrDefault(DayOfWeek.THURSDAY, 0);
        this.fri = quantities.getOrDefault(DayOfWeek.FRIDAY, 0);
        this.sat = quantities.getOrDefault(DayOfWeek.SATURDAY, 0);
        this.weeklyTotal = mon + tue + wed + thu + fri + sat;
        this.modelUsed = modelUsed;
        this.coldStart = coldStart;
        this.note = note;
    }

    void attachTo(ForecastRun run) {
        this.run = run;
    }

    public int getQuantity(DayOfWeek day) {
        switch (day) {
            case MONDAY: return mon;
            case TUESDAY: return tue;
            case WEDNESDAY: return wed;
            case THURSDAY: return thu;
            case FRIDAY: return fri;
            case SATURDAY: return sat;
            default: return 0;
        }
    }
}
