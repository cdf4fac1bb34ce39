package com.pharmaforecast.model;

public final class LinearDemandModel implements DemandModel {

    private final double intercept;
    private final double[] weights;

    public LinearDemandModel(double intercept, double[] weights) {
        if (weights.length != FeatureVector.FEATURE_NAMES.size()) {
            throw new IllegalArgumentException("Expected " + FeatureVector.FEATURE_NAMES.size()
                + " weights but got " + weights.length);
        }
        this.intercept = intercept;
        this.weights = weights.clone();
    }

    @Override
    public double predict(FeatureVector features) {
        double[] x = features.toArray();
        double y = intercept;
        for (int i = 0; i < x.length; i++) {
            y += weights[i] * x[i];
        }
        return y;
    }

    @Override
    public String describe() {
        return "linear";
    }
}
