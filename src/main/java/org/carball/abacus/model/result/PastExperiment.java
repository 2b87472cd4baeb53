package org.carball.abacus.model.result;

import java.time.LocalDate;

/**
 * One experiment/variation discovered in the assignment table.
 */
public record PastExperiment(
        String experimentId,
        String variationId,
        LocalDate startDate,
        LocalDate endDate,
        long users
) {}
