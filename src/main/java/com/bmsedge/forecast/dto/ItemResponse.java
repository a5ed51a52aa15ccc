package com.bmsedge.forecast.dto;

import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
public class ItemResponse {
    private Long id;
    private String canonicalName;
    private List<AliasResponse> aliases = new ArrayList<>();
    private Integer minBatchSize;
    private Integer roundingUnit;
    private BigDecimal tempCoefficient;
    private BigDecimal rainCoefficient;
    private Boolean active;
    private LocalDateTime createdAt;

    @Getter
    @Setter
    public static class AliasResponse {
        private String alias;
        private String origin;

        public AliasResponse() {}

        public AliasResponse(String alias, String origin) {
            this.alias = alias;
            this.origin = origin;
        }
    }
}
