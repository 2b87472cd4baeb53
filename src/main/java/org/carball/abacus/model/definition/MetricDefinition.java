package org.carball.abacus.model.definition;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MetricDefinition {

    private String id;
    private String name;
    private MetricType type;
    private String table;

    /**
     * Value column. Duration metrics may embed {@code {alias}}, replaced with the row alias.
     */
    private String column;

    @Builder.Default
    private List<MetricCondition> conditions = new ArrayList<>();

    @Builder.Default
    private IdentifierType userIdType = IdentifierType.ANONYMOUS;

    // Per-metric column overrides, take precedence over source settings
    private String userIdColumn;
    private String anonymousIdColumn;
    private String timestampColumn;

    /**
     * Per-user values above the cap are clamped. 0 means uncapped.
     */
    private double cap;

    private int conversionDelayHours;

    /**
     * Window of this metric's own rows. 0 falls back to the experiment's window.
     */
    private int conversionWindowHours;

    private boolean earlyStart;
    /** Passed through to the statistics layer, composition does not read it. */
    private boolean ignoreNulls;

    public boolean hasColumn() {
        return column != null && !column.isBlank();
    }

    public boolean isCapped() {
        return cap > 0;
    }

    public void validate() {
        if (type == null) {
            throw new IllegalArgumentException("Metric " + id + " has no type");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Metric " + id + " has no source table");
        }
        if (cap < 0) {
            throw new IllegalArgumentException("Metric " + id + " cap must not be negative: " + cap);
        }
        if (conversionWindowHours < 0) {
            throw new IllegalArgumentException(
                    "Metric " + id + " conversion window must not be negative: " + conversionWindowHours);
        }
        if (conversionDelayHours < 0) {
            throw new IllegalArgumentException(
                    "Metric " + id + " conversion delay must not be negative: " + conversionDelayHours);
        }
        if ((type == MetricType.DURATION || type == MetricType.REVENUE) && !hasColumn()) {
            throw new IllegalArgumentException("Metric " + id + " of type " + type + " requires a value column");
        }
    }
}
