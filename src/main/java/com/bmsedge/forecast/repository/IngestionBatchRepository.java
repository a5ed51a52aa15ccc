package com.bmsedge.forecast.repository;

import com.bmsedge.forecast.model.IngestionBatch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface IngestionBatchRepository extends JpaRepository<IngestionBatch, Long> {
}
