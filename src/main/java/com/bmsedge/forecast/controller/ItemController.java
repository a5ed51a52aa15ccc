package com.bmsedge.forecast.controller;

import com.bmsedge.forecast.dto.AliasRequest;
import com.bmsedge.forecast.dto.ItemResponse;
import com.bmsedge.forecast.dto.ItemSettingsRequest;
import com.bmsedge.forecast.service.ItemCatalogService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/items")
@CrossOrigin(origins = "*", maxAge = 3600)
public class ItemController {

    @Autowired
    private ItemCatalogService itemCatalogService;

    @GetMapping
    public ResponseEntity<List<ItemResponse>> getAllItems() {
        return ResponseEntity.ok(itemCatalogService.getAllItems());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ItemResponse> getItemById(@PathVariable Long id) {
        return ResponseEntity.ok(itemCatalogService.getItem(id));
    }

    @PostMapping("/{id}/aliases")
    public ResponseEntity<ItemResponse> addAlias(@PathVariable Long id, @Valid @RequestBody AliasRequest request) {
        return ResponseEntity.ok(itemCatalogService.addAlias(id, request.getAlias()));
    }

    @PutMapping("/{id}/settings")
    public ResponseEntity<ItemResponse> updateSettings(@PathVariable Long id,
                                                       @Valid @RequestBody ItemSettingsRequest request) {
        return ResponseEntity.ok(itemCatalogService.updateSettings(id, request));
    }
}
