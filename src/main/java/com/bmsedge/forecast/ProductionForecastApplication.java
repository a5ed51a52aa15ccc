package com.bmsedge.forecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProductionForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProductionForecastApplication.class, args);
    }
}
