package com.bmsedge.forecast.service;

import com.bmsedge.forecast.dto.TrainResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic retraining of all item models. Off unless {@code forecast.model.retrain.enabled=true}.
 */
@Component
public class ModelRetrainScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ModelRetrainScheduler.class);

    @Autowired
    private ItemModelTrainingService modelTrainingService;

    @Value("${forecast.model.retrain.enabled:false}")
    private boolean enabled;

    @Scheduled(cron = "${forecast.model.retrain.cron:0 0 3 * * SUN}")
    public void retrainAll() {
        if (!enabled) {
            return;
        }
        logger.info("Scheduled model retraining started");
        try {
            List<TrainResult> results = modelTrainingService.trainAll();
            logger.info("Scheduled model retraining finished for {} items", results.size());
        } catch (RuntimeException e) {
            logger.error("Scheduled model retraining failed: {}", e.getMessage(), e);
        }
    }
}
