package org.carball.abacus.model.definition;

/**
 * A single filter on a metric's source table, rendered as {@code column operator 'value'}.
 */
public record MetricCondition(
        String column,
        String operator,
        String value
) {}
