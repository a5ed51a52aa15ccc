package com.bmsedge.forecast.service;

import com.bmsedge.forecast.exception.PersistenceFailureException;
import com.bmsedge.forecast.model.ItemModel;
import com.bmsedge.forecast.repository.ItemModelRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Holds at most one model per item. Saving replaces the stored model wholesale; the
 * entity's version column guards against concurrent retrains.
 */
@Service
public class ItemModelStore {

    private static final Logger logger = LoggerFactory.getLogger(ItemModelStore.class);

    @Autowired
    private ItemModelRepository itemModelRepository;

    @Transactional
    public ItemModel save(ItemModel model) {
        try {
            Optional<ItemModel> existing = itemModelRepository.findByItemId(model.getItemId());
            ItemModel target;
            if (existing.isPresent()) {
                target = existing.get();
            } else {
                target = new ItemModel();
                target.setItemId(model.getItemId());
            }
            target.setAlgorithmTag(model.getAlgorithmTag());
            target.setSerializedParameters(model.getSerializedParameters());
            target.setFeatureSchema(model.getFeatureSchema());
            target.setTrainingSamples(model.getTrainingSamples());
            target.setCrossValError(model.getCrossValError());
            target.setLowConfidence(model.isLowConfidence());
            target.setTrainedAt(model.getTrainedAt() != null ? model.getTrainedAt() : LocalDateTime.now());

            // flush assigns the incremented version
            ItemModel saved = itemModelRepository.saveAndFlush(target);
            logger.info("Saved model v{} for item {}", saved.getVersion(), saved.getItemId());
            return saved;
        } catch (OptimisticLockingFailureException e) {
            throw new PersistenceFailureException("Model for item " + model.getItemId()
                    + " was retrained concurrently; retry the training", e);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to save model for item " + model.getItemId(), e);
        }
    }

    /**
     * @return true when a stored model was removed
     */
    @Transactional
    public boolean delete(Long itemId) {
        try {
            long removed = itemModelRepository.deleteByItemId(itemId);
            if (removed > 0) {
                logger.info("Removed model for item {}", itemId);
            }
            return removed > 0;
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to remove model for item " + itemId, e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<ItemModel> load(Long itemId) {
        try {
            return itemModelRepository.findByItemId(itemId);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load model for item " + itemId, e);
        }
    }
}
