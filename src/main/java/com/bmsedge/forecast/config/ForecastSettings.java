package com.bmsedge.forecast.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Named forecasting parameters. Every value has a default here and is documented
 * in application.properties; per-item overrides live on the Item row.
 */
@Getter
@Setter
@Component
public class ForecastSettings {

    // ==================== NORMALIZER ====================

    @Value("${forecast.normalizer.date-headers:date,business date,order date,sales date,transaction date,payment date}")
    private String[] dateHeaders = {"date", "business date", "order date", "sales date",
            "transaction date", "payment date"};

    @Value("${forecast.normalizer.item-headers:item_name,item name,item,price point name,product,item/variation,item - variation,variation,item variation,product name,sku name}")
    private String[] itemHeaders = {"item_name", "item name", "item", "price point name", "product",
            "item/variation", "item - variation", "variation", "item variation", "product name", "sku name"};

    @Value("${forecast.normalizer.quantity-headers:quantity_sold,qty,quantity,count,units,unit,quantity sold,net quantity,qty sold,sales quantity}")
    private String[] quantityHeaders = {"quantity_sold", "qty", "quantity", "count", "units", "unit",
            "quantity sold", "net quantity", "qty sold", "sales quantity"};

    @Value("${forecast.normalizer.variation-headers:item variation,variation,price point name}")
    private String[] variationHeaders = {"item variation", "variation", "price point name"};

    @Value("${forecast.normalizer.refund-type-headers:event type,itemisation type,itemization type}")
    private String[] refundTypeHeaders = {"event type", "itemisation type", "itemization type"};

    @Value("${forecast.normalizer.refund-terms:refund,return}")
    private String[] refundTerms = {"refund", "return"};

    @Value("${forecast.normalizer.wide-min-date-columns:5}")
    private int wideMinDateColumns = 5;

    // ==================== RESOLVER ====================

    @Value("${forecast.resolver.similarity-threshold:0.75}")
    private double similarityThreshold = 0.75;

    /** Semicolon separated {@code regex => Canonical Name} entries. */
    @Value("${forecast.resolver.rules:}")
    private String canonicalRules = "";

    // ==================== BASELINE ====================

    @Value("${forecast.baseline.window-weeks:8}")
    private int windowWeeks = 8;

    @Value("${forecast.baseline.decay:0.9}")
    private double decay = 0.9;

    @Value("${forecast.baseline.lookback-weeks:26}")
    private int lookbackWeeks = 26;

    // ==================== ADJUSTMENT ====================

    @Value("${forecast.adjustment.min-multiplier:0.5}")
    private double minMultiplier = 0.5;

    @Value("${forecast.adjustment.max-multiplier:1.5}")
    private double maxMultiplier = 1.5;

    @Value("${forecast.adjustment.default-temp-coefficient:0.0}")
    private double defaultTempCoefficient = 0.0;

    @Value("${forecast.adjustment.default-rain-coefficient:0.0}")
    private double defaultRainCoefficient = 0.0;

    @Value("${forecast.adjustment.anchor-temp:20.0}")
    private double anchorTemp = 20.0;

    @Value("${forecast.adjustment.anchor-rain:1.0}")
    private double anchorRain = 1.0;

    @Value("${forecast.adjustment.weather-stale-days:14}")
    private int weatherStaleDays = 14;

    @Value("${forecast.location:default}")
    private String location = "default";

    // ==================== MODEL ====================

    @Value("${forecast.model.min-training-samples:20}")
    private int minTrainingSamples = 20;

    @Value("${forecast.model.ridge-alpha:1.0}")
    private double ridgeAlpha = 1.0;

    @Value("${forecast.model.max-cv-mape:50.0}")
    private double maxCvMape = 50.0;

    @Value("${forecast.model.train-after-ingest:false}")
    private boolean trainAfterIngest = false;

    // ==================== BLEND ====================

    @Value("${forecast.blend.default-min-batch-size:0}")
    private int defaultMinBatchSize = 0;

    @Value("${forecast.blend.alert-std-multiple:1.5}")
    private double alertStdMultiple = 1.5;

    // ==================== READINESS ====================

    @Value("${forecast.readiness.enforce:true}")
    private boolean enforceReadiness = true;

    @Value("${forecast.readiness.max-staleness-days:2}")
    private int maxStalenessDays = 2;
}
