package com.bmsedge.forecast.ml;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * Per-date feature vector shared by training and prediction.
 */
public final class FeatureBuilder {

    public static final List<String> FEATURE_NAMES = List.of(
            "wd_mon", "wd_tue", "wd_wed", "wd_thu", "wd_fri", "wd_sat",
            "max_temp", "rain_mm", "is_holiday", "month_sin", "month_cos");

    private FeatureBuilder() {}

    /**
     * @param maxTemp   null is replaced by {@code medianMaxTemp}
     * @param rainMm    null is replaced by {@code medianRainMm}
     */
    public static double[] build(LocalDate date, Double maxTemp, Double rainMm, boolean holiday,
                                 double medianMaxTemp, double medianRainMm) {
        double[] f = new double[FEATURE_NAMES.size()];
        DayOfWeek dow = date.getDayOfWeek();
        if (dow != DayOfWeek.SUNDAY) {
            f[dow.getValue() - 1] = 1.0;
        }
        f[6] = maxTemp != null ? maxTemp : medianMaxTemp;
        f[7] = rainMm != null ? rainMm : medianRainMm;
        f[8] = holiday ? 1.0 : 0.0;
        double angle = 2 * Math.PI * date.getMonthValue() / 12.0;
        f[9] = Math.sin(angle);
        f[10] = Math.cos(angle);
        return f;
    }
}
