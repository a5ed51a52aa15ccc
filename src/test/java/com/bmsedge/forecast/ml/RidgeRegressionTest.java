package com.bmsedge.forecast.ml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class RidgeRegressionTest {

    @Test
    @DisplayName("Without regularization a linear relation is recovered exactly")
    void testRecoversLinearRelation() {
        // y = 3 + 2 * x1 - x2
        double[][] x = {{1, 5}, {2, 3}, {3, 8}, {4, 1}, {5, 6}, {6, 2}};
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = 3 + 2 * x[i][0] - x[i][1];
        }

        ModelParameters params = RidgeRegression.fit(x, y, 0.0);

        assertEquals(3 + 2 * 10 - 4, params.predict(new double[]{10, 4}), 1e-6);
    }

    @Test
    @DisplayName("A larger penalty shrinks predictions towards the mean")
    void testPenaltyShrinks() {
        double[][] x = {{0}, {1}, {2}, {3}, {4}};
        double[] y = {0, 10, 20, 30, 40};

        double loose = RidgeRegression.fit(x, y, 0.1).predict(new double[]{4});
        double tight = RidgeRegression.fit(x, y, 100.0).predict(new double[]{4});

        assertTrue(loose > tight);
        assertTrue(tight > 20.0);
    }

    @Test
    @DisplayName("Constant and collinear columns do not break the fit")
    void testDegenerateColumns() {
        double[][] x = {{1, 7, 2}, {2, 7, 4}, {3, 7, 6}, {4, 7, 8}};
        double[] y = {5, 7, 9, 11};

        ModelParameters params = RidgeRegression.fit(x, y, 0.0);

        assertEquals(1.0, params.getScales()[1]);
        assertFalse(Double.isNaN(params.predict(new double[]{2.5, 7, 5})));
        assertEquals(8.0, params.predict(new double[]{2.5, 7, 5}), 1e-6);
    }

    @Test
    @DisplayName("Invalid inputs are rejected")
    void testInvalidInputs() {
        assertThrows(IllegalArgumentException.class, () -> RidgeRegression.fit(new double[0][], new double[0], 1.0));
        assertThrows(IllegalArgumentException.class, () -> RidgeRegression.fit(new double[][]{{1}}, new double[]{1}, -1.0));
        ModelParameters params = RidgeRegression.fit(new double[][]{{1}, {2}}, new double[]{1, 2}, 1.0);
        assertThrows(IllegalArgumentException.class, () -> params.predict(new double[]{1, 2}));
    }

    @Test
    @DisplayName("Feature vectors encode weekday, weather, holiday and season")
    void testFeatureBuilder() {
        double[] saturday = FeatureBuilder.build(LocalDate.of(2025, 3, 15), null, 4.0, true, 21.5, 0.0);

        assertEquals(FeatureBuilder.FEATURE_NAMES.size(), saturday.length);
        assertEquals(1.0, saturday[5]);
        assertEquals(0.0, saturday[0]);
        assertEquals(21.5, saturday[6]);
        assertEquals(4.0, saturday[7]);
        assertEquals(1.0, saturday[8]);
        assertEquals(1.0, saturday[9], 1e-9);

        double[] sunday = FeatureBuilder.build(LocalDate.of(2025, 3, 16), 20.0, null, false, 0.0, 0.0);
        for (int i = 0; i < 6; i++) {
            assertEquals(0.0, sunday[i]);
        }
    }
}
