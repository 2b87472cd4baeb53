package org.carball.abacus.model.result;

import java.util.List;
import java.util.Optional;

/**
 * Per dimension value results plus the exact SQL that produced them.
 */
public record ExperimentResults(List<DimensionResult> results, String query) {

    public Optional<DimensionResult> dimension(String value) {
        return results.stream()
                .filter(r -> r.dimension().equals(value))
                .findFirst();
    }
}
