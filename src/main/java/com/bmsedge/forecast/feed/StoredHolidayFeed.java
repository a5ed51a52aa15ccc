package com.bmsedge.forecast.feed;

import com.bmsedge.forecast.exception.SignalUnavailableException;
import com.bmsedge.forecast.model.AdjustmentSignal;
import com.bmsedge.forecast.model.CalendarEvent;
import com.bmsedge.forecast.model.SignalKind;
import com.bmsedge.forecast.repository.CalendarEventRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Holidays and events read from the calendar table. An uplift of +15% becomes multiplier 1.15.
 */
@Component
public class StoredHolidayFeed implements HolidayFeed {

    @Autowired
    private CalendarEventRepository calendarEventRepository;

    @Override
    public List<AdjustmentSignal> get(LocalDate date) {
        try {
            return calendarEventRepository.findByEventDate(date).stream()
                    .map(this::toSignal)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new SignalUnavailableException("Calendar lookup failed for " + date, e);
        }
    }

    private AdjustmentSignal toSignal(CalendarEvent event) {
        BigDecimal uplift = event.getUpliftPct() != null ? event.getUpliftPct() : BigDecimal.ZERO;
        double weight = event.getWeight() != null ? event.getWeight().doubleValue() : 1.0;
        weight = Math.max(0.0, Math.min(1.0, weight));
        SignalKind kind = event.getKind() != null ? event.getKind() : SignalKind.EVENT;
        return new AdjustmentSignal(event.getEventDate(), kind, event.getEventName(),
                1.0 + uplift.doubleValue() / 100.0, weight);
    }
}
