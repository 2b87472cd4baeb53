package org.carball.abacus.model.result;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Data
public class MetricValueResult {
    private long count;
    private double mean;
    private double stddev;

    /**
     * Percentile (1-99) to value. Empty when percentiles were not requested.
     */
    private Map<Integer, Double> percentiles = new TreeMap<>();

    private List<DateMetricValue> dates = new ArrayList<>();

    public boolean hasPercentiles() {
        return !percentiles.isEmpty();
    }

    public boolean hasDates() {
        return !dates.isEmpty();
    }
}
