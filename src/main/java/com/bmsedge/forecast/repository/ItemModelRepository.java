package com.bmsedge.forecast.repository;

import com.bmsedge.forecast.model.ItemModel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ItemModelRepository extends JpaRepository<ItemModel, Long> {

    Optional<ItemModel> findByItemId(Long itemId);

    long deleteByItemId(Long itemId);
}
