package org.carball.abacus.model.result;

public record DateMetricValue(String date, long count, double mean, double stddev) {}
