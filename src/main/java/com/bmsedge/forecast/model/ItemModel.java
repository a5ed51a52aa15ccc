package com.bmsedge.forecast.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Trained per-item regression model. One row per item; retraining replaces every
 * field in a single transaction. {@code version} is the optimistic lock, so of two
 * concurrent retrains of the same item only the first commit wins.
 */
@Getter
@Setter
@Entity
@Table(name = "item_models",
        uniqueConstraints = @UniqueConstraint(name = "uk_item_models_item", columnNames = "item_id"))
public class ItemModel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(name = "algorithm_tag", length = 50, nullable = false)
    private String algorithmTag;

    @Column(name = "serialized_parameters", columnDefinition = "TEXT", nullable = false)
    private String serializedParameters;

    @Column(name = "feature_schema", columnDefinition = "TEXT")
    private String featureSchema;

    @Column(name = "training_samples")
    private Integer trainingSamples;

    /** Cross-validation MAPE in percent; null when no fold could be evaluated. */
    @Column(name = "cross_val_error")
    private Double crossValError;

    @Column(name = "low_confidence")
    private Boolean lowConfidence = false;

    // 0 on first save, incremented by every retrain
    @Version
    @Column(name = "version")
    private Integer version;

    @Column(name = "trained_at")
    private LocalDateTime trainedAt;

    public boolean isLowConfidence() {
        return Boolean.TRUE.equals(lowConfidence);
    }
}
