package com.bmsedge.forecast.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Getter
@Setter
@Entity
@Table(name = "weather_observations",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_weather_location_date",
                columnNames = {"location", "observation_date"}
        ))
public class WeatherObservation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "location", nullable = false, length = 100)
    private String location;

    @NotNull
    @Column(name = "observation_date", nullable = false)
    private LocalDate observationDate;

    @Column(name = "max_temp")
    private Double maxTemp;

    @Column(name = "rain_mm")
    private Double rainMm;

    @Column(name = "source", length = 50)
    private String source;

    @Column(name = "recorded_at")
    private LocalDateTime recordedAt;

    @PrePersist
    @PreUpdate
    protected void onSave() {
        if (recordedAt == null) {
            recordedAt = LocalDateTime.now();
        }
    }
}
