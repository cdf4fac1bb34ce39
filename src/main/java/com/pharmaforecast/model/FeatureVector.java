package com.pharmaforecast.model;

import java.util.List;

/**
 * Fixed-shape model input for one (drug, target date) pair.
 *
 * <p>Field order matches {@link #FEATURE_NAMES}, which is the column order the
 * external trainer fits models with. Tree splits in model artifacts refer to
 * features either by these names or by their position ({@code f0..f15}).
 */
public record FeatureVector(
    int dayOfWeek,
    int dayOfMonth,
    int month,
    int weekOfMonth,
    boolean weekend,
    boolean monthEnd,
    boolean rainySeason,
    double usageLag1,
    double usageLag3,
    double usageLag7,
    double usageLag14,
    double usageMean7d,
    double usageStd7d,
    double usageMean14d,
    double usageStd14d,
    double stockLevelRatio
) {

    public static final List<String> FEATURE_NAMES = List.of(
        "day_of_week", "day_of_month", "month", "week_of_month",
        "is_weekend", "is_month_end", "is_rainy_season",
        "usage_lag_1", "usage_lag_3", "usage_lag_7", "usage_lag_14",
        "usage_mean_7d", "usage_std_7d", "usage_mean_14d", "usage_std_14d",
        "stock_level_ratio"
    );

    public double[] toArray() {
        return new double[] {
            dayOfWeek, dayOfMonth, month, weekOfMonth,
            weekend ? 1 : 0, monthEnd ? 1 : 0, rainySeason ? 1 : 0,
            usageLag1, usageLag3, usageLag7, usageLag14,
            usageMean7d, usageStd7d, usageMean14d, usageStd14d,
            stockLevelRatio
        };
    }

    /**
     * Resolves a feature reference as written in a model artifact.
     *
     * @return the feature index, or -1 when the reference is unknown
     */
    public static int indexOf(String feature) {
        int byName = FEATURE_NAMES.indexOf(feature);
        if (byName >= 0) {
            return byName;
        }
        if (feature != null && feature.length() > 1 && feature.charAt(0) == 'f') {
            try {
                int idx = Integer.parseInt(feature.substring(1));
                return idx < FEATURE_NAMES.size() ? idx : -1;
            } catch (NumberFormatException ignored) {
                return -1;
            }
        }
        return -1;
    }
}
