package com.bmsedge.forecast.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class AliasRequest {

    @NotBlank
    @Size(max = 200)
    private String alias;

    public AliasRequest() {}

    public AliasRequest(String alias) {
        this.alias = alias;
    }
}
