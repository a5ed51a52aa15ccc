package com.bmsedge.forecast.ml;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Fitted ridge parameters on the standardized feature space, stored as JSON on the item model row.
 */
@Data
@NoArgsConstructor
public class ModelParameters {

    private List<String> featureNames = new ArrayList<>();
    private double[] means;
    private double[] scales;
    private double[] coefficients;
    private double intercept;
    private double alpha;

    // Imputation values for missing weather at prediction time
    private double medianMaxTemp;
    private double medianRainMm;

    public double predict(double[] features) {
        if (features.length != coefficients.length) {
            throw new IllegalArgumentException("Expected " + coefficients.length
                    + " features but got " + features.length);
        }
        double y = intercept;
        for (int j = 0; j < coefficients.length; j++) {
            y += coefficients[j] * (features[j] - means[j]) / scales[j];
        }
        return y;
    }
}
