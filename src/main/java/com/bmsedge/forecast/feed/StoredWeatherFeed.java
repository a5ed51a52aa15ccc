package com.bmsedge.forecast.feed;

import com.bmsedge.forecast.exception.SignalUnavailableException;
import com.bmsedge.forecast.model.WeatherConditions;
import com.bmsedge.forecast.repository.WeatherObservationRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Weather read from observations imported through the signal upload endpoint.
 */
@Component
public class StoredWeatherFeed implements WeatherFeed {

    @Autowired
    private WeatherObservationRepository weatherObservationRepository;

    @Override
    public Optional<WeatherConditions> get(LocalDate date, String location) {
        try {
            return weatherObservationRepository.findByLocationAndObservationDate(location, date)
                    .map(o -> new WeatherConditions(o.getObservationDate(), o.getMaxTemp(),
                            o.getRainMm(), o.getRecordedAt()));
        } catch (DataAccessException e) {
            throw new SignalUnavailableException("Weather lookup failed for " + location + " on " + date, e);
        }
    }
}
