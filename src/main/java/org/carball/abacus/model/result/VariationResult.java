package org.carball.abacus.model.result;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class VariationResult {
    private final int variation;
    private long users;

    /**
     * One entry per metric, in the order the metrics were requested.
     */
    private final List<VariationMetricResult> metrics = new ArrayList<>();
}
