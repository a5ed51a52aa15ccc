package com.bmsedge.forecast.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@Entity
@Table(name = "item_aliases",
        uniqueConstraints = @UniqueConstraint(name = "uk_item_aliases_alias", columnNames = "alias"),
        indexes = @Index(name = "idx_item_aliases_item", columnList = "item_id"))
public class ItemAlias {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "item_id", nullable = false)
    private Item item;

    @NotBlank
    @Column(name = "alias", nullable = false, length = 200)
    private String alias;

    @Enumerated(EnumType.STRING)
    @Column(name = "origin", length = 20)
    private AliasOrigin origin;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    public ItemAlias() {}

    public ItemAlias(Item item, String alias, AliasOrigin origin) {
        this.item = item;
        this.alias = alias;
        this.origin = origin;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
