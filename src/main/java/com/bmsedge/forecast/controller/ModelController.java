package com.bmsedge.forecast.controller;

import com.bmsedge.forecast.dto.TrainResult;
import com.bmsedge.forecast.exception.ResourceNotFoundException;
import com.bmsedge.forecast.model.ItemModel;
import com.bmsedge.forecast.service.ItemModelTrainingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/models")
@CrossOrigin(origins = "*", maxAge = 3600)
public class ModelController {

    private static final Logger logger = LoggerFactory.getLogger(ModelController.class);

    @Autowired
    private ItemModelTrainingService modelTrainingService;

    @PostMapping("/train")
    public ResponseEntity<Map<String, Object>> trainAll() {
        logger.info("Training requested for all items");
        List<TrainResult> results = modelTrainingService.trainAll();

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("results", results);
        response.put("trained", results.stream().filter(TrainResult::isTrained).count());
        response.put("total", results.size());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/train/{itemId}")
    public ResponseEntity<TrainResult> trainItem(@PathVariable Long itemId) {
        logger.info("Training requested for item {}", itemId);
        return ResponseEntity.ok(modelTrainingService.train(itemId));
    }

    @GetMapping("/{itemId}")
    public ResponseEntity<Map<String, Object>> getModel(@PathVariable Long itemId) {
        ItemModel model = modelTrainingService.findModel(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("No model trained for item " + itemId));

        Map<String, Object> response = new HashMap<>();
        response.put("itemId", model.getItemId());
        response.put("algorithmTag", model.getAlgorithmTag());
        response.put("featureSchema", model.getFeatureSchema());
        response.put("trainingSamples", model.getTrainingSamples());
        response.put("crossValError", model.getCrossValError());
        response.put("lowConfidence", model.isLowConfidence());
        response.put("version", model.getVersion());
        response.put("trainedAt", model.getTrainedAt());
        return ResponseEntity.ok(response);
    }
}
