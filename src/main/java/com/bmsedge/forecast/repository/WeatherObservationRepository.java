package com.bmsedge.forecast.repository;

import com.bmsedge.forecast.model.WeatherObservation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface WeatherObservationRepository extends JpaRepository<WeatherObservation, Long> {

    Optional<WeatherObservation> findByLocationAndObservationDate(String location, LocalDate observationDate);
}
