package com.bmsedge.forecast.service;

import com.bmsedge.forecast.exception.PersistenceFailureException;
import com.bmsedge.forecast.exception.ResourceNotFoundException;
import com.bmsedge.forecast.model.ForecastRun;
import com.bmsedge.forecast.model.ItemForecast;
import com.bmsedge.forecast.repository.ForecastRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of forecast runs. Runs are never updated or deleted.
 */
@Service
public class ForecastRunRecorder {

    private static final Logger logger = LoggerFactory.getLogger(ForecastRunRecorder.class);

    @Autowired
    private ForecastRunRepository forecastRunRepository;

    @Transactional
    public ForecastRun record(LocalDate weekStart, double alpha, boolean useModel, List<ItemForecast> items) {
        ForecastRun run = new ForecastRun(weekStart,
                BigDecimal.valueOf(alpha).setScale(3, RoundingMode.HALF_UP),
                useModel, LocalDateTime.now());
        for (ItemForecast item : items) {
            run.addLine(item.getLine());
            item.getAlerts().forEach(run::addAlert);
        }

        try {
            ForecastRun saved = forecastRunRepository.save(run);
            logger.info("Recorded forecast run {} for week {}: {} items, {} alerts",
                    saved.getId(), weekStart, saved.getLines().size(), saved.getAlerts().size());
            return saved;
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to record forecast run for week " + weekStart, e);
        }
    }

    @Transactional(readOnly = true)
    public List<ForecastRun> runsForWeek(LocalDate weekStart) {
        return forecastRunRepository.findByWeekNewestFirst(weekStart);
    }

    @Transactional(readOnly = true)
    public Optional<ForecastRun> latestForWeek(LocalDate weekStart) {
        return forecastRunRepository.findFirstByWeekStartDateOrderByCreatedAtDescIdDesc(weekStart);
    }

    @Transactional(readOnly = true)
    public Optional<ForecastRun> latest() {
        return forecastRunRepository.findFirstByOrderByCreatedAtDescIdDesc();
    }

    @Transactional(readOnly = true)
    public ForecastRun getRun(Long runId) {
        return forecastRunRepository.findById(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Forecast run not found with id: " + runId));
    }

    @Transactional(readOnly = true)
    public Page<ForecastRun> recentRuns(int page, int size) {
        return forecastRunRepository.findRecent(PageRequest.of(Math.max(page, 0), Math.max(1, Math.min(size, 100))));
    }
}
