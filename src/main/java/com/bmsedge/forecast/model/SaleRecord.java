package com.bmsedge.forecast.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Canonical sales observation: one row per (item, date), quantity already net of refunds.
 */
@Getter
@Setter
@Entity
@Table(name = "sale_records",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_sale_records_item_date",
                columnNames = {"item_id", "sale_date"}
        ),
        indexes = {
                @Index(name = "idx_sale_records_date", columnList = "sale_date"),
                @Index(name = "idx_sale_records_item_date", columnList = "item_id, sale_date")
        })
public class SaleRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @NotNull
    @Column(name = "sale_date", nullable = false)
    private LocalDate saleDate;

    @NotNull
    @Column(name = "quantity", precision = 12, scale = 3, nullable = false)
    private BigDecimal quantity = BigDecimal.ZERO;

    @Column(name = "source_row_ref", length = 500)
    private String sourceRowRef;

    @Column(name = "batch_id")
    private Long batchId;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public SaleRecord() {}

    public SaleRecord(Long itemId, LocalDate saleDate, BigDecimal quantity) {
        this.itemId = itemId;
        this.saleDate = saleDate;
        this.quantity = quantity;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
