package org.carball.abacus.model.definition;

public enum MetricType {
    BINOMIAL,
    COUNT,
    DURATION,
    REVENUE;

    /**
     * Binomial metrics only record presence, so they carry no distribution to take percentiles of.
     */
    public boolean hasDistribution() {
        return this != BINOMIAL;
    }
}
