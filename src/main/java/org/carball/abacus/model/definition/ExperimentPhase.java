package org.carball.abacus.model.definition;

import java.time.Instant;
import java.util.Optional;

/**
 * Date range of one experiment phase. A missing end means the phase is still running.
 */
public record ExperimentPhase(
        Instant dateStarted,
        Instant dateEnded
) {

    public ExperimentPhase {
        if (dateStarted == null) {
            throw new IllegalArgumentException("Experiment phase requires a start date");
        }
    }

    public static ExperimentPhase running(Instant dateStarted) {
        return new ExperimentPhase(dateStarted, null);
    }

    public Optional<Instant> end() {
        return Optional.ofNullable(dateEnded);
    }
}
