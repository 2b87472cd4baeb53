package org.carball.abacus.model.definition;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExperimentDefinition {

    /**
     * Key under which {@link #getSqlOverrides()} replaces the users query.
     */
    public static final String USERS_OVERRIDE_KEY = "users";

    private String id;
    private String trackingKey;

    @Builder.Default
    private IdentifierType userIdType = IdentifierType.ANONYMOUS;

    /**
     * Variation keys in declaration order. The position is the variation index.
     */
    @Builder.Default
    private List<String> variations = new ArrayList<>();

    @Builder.Default
    private List<ExperimentPhase> phases = new ArrayList<>();

    @Builder.Default
    private int conversionWindowHours = 72;

    /**
     * Raw SQL replacing a composed query, keyed by metric id or {@value #USERS_OVERRIDE_KEY}.
     */
    @Builder.Default
    private Map<String, String> sqlOverrides = new HashMap<>();

    public Optional<String> sqlOverride(String key) {
        if (sqlOverrides == null) {
            return Optional.empty();
        }
        String sql = sqlOverrides.get(key);
        return sql == null || sql.isBlank() ? Optional.empty() : Optional.of(sql);
    }

    public ExperimentPhase phase(int index) {
        if (index < 0 || index >= phases.size()) {
            throw new IllegalArgumentException(
                    "Experiment " + trackingKey + " has no phase " + index + " (" + phases.size() + " phases)");
        }
        return phases.get(index);
    }

    public ExperimentPhase latestPhase() {
        return phase(phases.size() - 1);
    }

    public int variationCount() {
        return variations.size();
    }

    public void validate() {
        if (trackingKey == null || trackingKey.isBlank()) {
            throw new IllegalArgumentException("Experiment " + id + " has no tracking key");
        }
        if (variations == null || variations.isEmpty()) {
            throw new IllegalArgumentException("Experiment " + trackingKey + " has no variations");
        }
        if (conversionWindowHours < 0) {
            throw new IllegalArgumentException(
                    "Experiment " + trackingKey + " conversion window must not be negative: " + conversionWindowHours);
        }
    }
}
