package org.carball.abacus.model.result;

public record VariationMetricResult(String metric, long count, double mean, double stddev) {}
