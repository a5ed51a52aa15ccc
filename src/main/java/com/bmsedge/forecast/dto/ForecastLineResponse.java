package com.bmsedge.forecast.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ForecastLineResponse {
    private Long itemId;
    private String itemName;
    private Integer mon;
    private Integer tue;
    private Integer wed;
    private Integer thu;
    private Integer fri;
    private Integer sat;
    private Integer weeklyTotal;
    private Boolean modelUsed;
    private Boolean coldStart;
    private String note;
}
