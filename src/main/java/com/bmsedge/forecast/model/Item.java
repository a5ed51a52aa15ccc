package com.bmsedge.forecast.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Entity
@Table(name = "items",
        uniqueConstraints = @UniqueConstraint(name = "uk_items_canonical_name", columnNames = "canonical_name"),
        indexes = @Index(name = "idx_items_active", columnList = "active"))
public class Item {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 200)
    @Column(name = "canonical_name", nullable = false)
    private String canonicalName;

    @OneToMany(mappedBy = "item", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<ItemAlias> aliases = new ArrayList<>();

    // Production constraints
    @Column(name = "min_batch_size")
    private Integer minBatchSize;

    @Column(name = "rounding_unit")
    private Integer roundingUnit;

    // Precomputed weather response; null means "use configured default"
    @Column(name = "temp_coefficient", precision = 8, scale = 4)
    private BigDecimal tempCoefficient;

    @Column(name = "rain_coefficient", precision = 8, scale = 4)
    private BigDecimal rainCoefficient;

    @Column(name = "active")
    private Boolean active = true;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Item() {}

    public Item(String canonicalName) {
        this.canonicalName = canonicalName;
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

    public ItemAlias addAlias(String alias, AliasOrigin origin) {
        ItemAlias itemAlias = new ItemAlias(this, alias, origin);
        aliases.add(itemAlias);
        return itemAlias;
    }

    public boolean isActive() {
        return active == null || active;
    }

    public int getEffectiveRoundingUnit() {
        return roundingUnit != null && roundingUnit > 0 ? roundingUnit : 1;
    }
}
