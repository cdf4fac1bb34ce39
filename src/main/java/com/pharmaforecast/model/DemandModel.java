package com.pharmaforecast.model;

/**
 * A trained per-drug regressor. Implementations are immutable and safe to
 * share between request threads.
 */
public interface DemandModel {

    double predict(FeatureVector features);

    String describe();
}
