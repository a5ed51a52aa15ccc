package com.bmsedge.forecast.service;

import com.bmsedge.forecast.dto.ItemResponse;
import com.bmsedge.forecast.dto.ItemSettingsRequest;
import com.bmsedge.forecast.exception.BusinessException;
import com.bmsedge.forecast.exception.ResourceNotFoundException;
import com.bmsedge.forecast.model.AliasOrigin;
import com.bmsedge.forecast.model.Item;
import com.bmsedge.forecast.model.ItemAlias;
import com.bmsedge.forecast.repository.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Service
@Transactional
public class ItemCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(ItemCatalogService.class);

    @Autowired
    private ItemRepository itemRepository;

    @Transactional(readOnly = true)
    public List<ItemResponse> getAllItems() {
        return itemRepository.findAllWithAliases().stream()
                .sorted(Comparator.comparing(Item::getCanonicalName, String.CASE_INSENSITIVE_ORDER))
                .map(this::convertToResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ItemResponse getItem(Long id) {
        return convertToResponse(findItem(id));
    }

    /**
     * Links a raw name to an item explicitly. A name already known for another item is refused;
     * items are never merged here.
     */
    public ItemResponse addAlias(Long id, String alias) {
        Item item = findItem(id);
        String trimmed = alias.trim().replaceAll("\\s+", " ");
        String key = ItemResolver.normalize(trimmed);
        if (key.isEmpty()) {
            throw new BusinessException("Alias must contain letters or digits");
        }

        for (Item other : itemRepository.findAllWithAliases()) {
            boolean known = ItemResolver.normalize(other.getCanonicalName()).equals(key)
                    || other.getAliases().stream().anyMatch(a -> ItemResolver.normalize(a.getAlias()).equals(key));
            if (!known) continue;
            if (other.getId().equals(item.getId())) {
                return convertToResponse(item);
            }
            throw new BusinessException("'" + trimmed + "' already refers to item '" + other.getCanonicalName() + "'");
        }

        item.addAlias(trimmed, AliasOrigin.EXPLICIT);
        Item saved = itemRepository.save(item);
        logger.info("Added alias '{}' to item '{}'", trimmed, saved.getCanonicalName());
        return convertToResponse(saved);
    }

    public ItemResponse updateSettings(Long id, ItemSettingsRequest request) {
        Item item = findItem(id);
        if (request.getMinBatchSize() != null) item.setMinBatchSize(request.getMinBatchSize());
        if (request.getRoundingUnit() != null) item.setRoundingUnit(request.getRoundingUnit());
        if (request.getTempCoefficient() != null) item.setTempCoefficient(request.getTempCoefficient());
        if (request.getRainCoefficient() != null) item.setRainCoefficient(request.getRainCoefficient());
        if (request.getActive() != null) item.setActive(request.getActive());

        Item saved = itemRepository.save(item);
        logger.info("Updated settings of item '{}': floor={}, unit={}, tempCoef={}, rainCoef={}, active={}",
                saved.getCanonicalName(), saved.getMinBatchSize(), saved.getRoundingUnit(),
                saved.getTempCoefficient(), saved.getRainCoefficient(), saved.isActive());
        return convertToResponse(saved);
    }

    private Item findItem(Long id) {
        return itemRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Item not found with id: " + id));
    }

    private ItemResponse convertToResponse(Item item) {
        ItemResponse response = new ItemResponse();
        response.setId(item.getId());
        response.setCanonicalName(item.getCanonicalName());
        for (ItemAlias alias : item.getAliases()) {
            response.getAliases().add(new ItemResponse.AliasResponse(alias.getAlias(),
                    alias.getOrigin() != null ? alias.getOrigin().name() : null));
        }
        response.setMinBatchSize(item.getMinBatchSize());
        response.setRoundingUnit(item.getRoundingUnit());
        response.setTempCoefficient(item.getTempCoefficient());
        response.setRainCoefficient(item.getRainCoefficient());
        response.setActive(item.isActive());
        response.setCreatedAt(item.getCreatedAt());
        return response;
    }
}
