package com.bmsedge.forecast.repository;

import com.bmsedge.forecast.model.Item;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ItemRepository extends JpaRepository<Item, Long> {

    @Query("SELECT i FROM Item i WHERE i.active IS NULL OR i.active = true ORDER BY i.canonicalName")
    List<Item> findActiveItems();

    @Query("SELECT DISTINCT i FROM Item i LEFT JOIN FETCH i.aliases")
    List<Item> findAllWithAliases();
}
