package org.carball.abacus.query;

import org.carball.abacus.dialect.SqlLiterals;
import org.carball.abacus.model.definition.MetricCondition;
import org.carball.abacus.model.definition.MetricDefinition;
import org.carball.abacus.model.definition.MetricType;

import java.util.stream.Collectors;

/**
 * Per metric type value expressions.
 *
 * <pre>
 * type      raw value                 per-user aggregate
 * binomial  1                         1
 * count     column, else 1            COUNT(DISTINCT value), else COUNT(*)   capped
 * duration  column ({alias} allowed)  MAX(value)                             capped
 * revenue   column                    MAX(value)                             capped
 * </pre>
 */
public final class MetricExpressions {

    public static final String ALIAS_PLACEHOLDER = "{alias}";
    public static final String DEFAULT_VALUE_COLUMN = "m.value";

    private MetricExpressions() {
        // Utility class - prevent instantiation
    }

    public static String metricColumn(MetricDefinition metric, String alias) {
        if (metric.getType() == MetricType.DURATION && metric.getColumn().contains(ALIAS_PLACEHOLDER)) {
            return metric.getColumn().replace(ALIAS_PLACEHOLDER, alias);
        }
        return alias + "." + metric.getColumn();
    }

    public static String rawValue(MetricDefinition metric, String alias) {
        return switch (metric.getType()) {
            case COUNT -> metric.hasColumn() ? metricColumn(metric, alias) : "1";
            case DURATION, REVENUE -> metricColumn(metric, alias);
            case BINOMIAL -> "1";
        };
    }

    public static String aggregateValue(MetricDefinition metric) {
        return aggregateValue(metric, DEFAULT_VALUE_COLUMN);
    }

    public static String aggregateValue(MetricDefinition metric, String valueColumn) {
        return switch (metric.getType()) {
            case COUNT -> capValue(metric,
                    "COUNT(" + (metric.hasColumn() ? "DISTINCT " + valueColumn : "*") + ")");
            case DURATION, REVENUE -> capValue(metric, "MAX(" + valueColumn + ")");
            case BINOMIAL -> "1";
        };
    }

    public static String capValue(MetricDefinition metric, String value) {
        if (!metric.isCapped()) {
            return value;
        }
        return "LEAST(" + SqlLiterals.number(metric.getCap()) + ", " + value + ")";
    }

    /**
     * {@code WHERE} clause conjoining the metric's conditions, empty when there are none.
     */
    public static String conditions(MetricDefinition metric, String alias) {
        if (metric.getConditions() == null || metric.getConditions().isEmpty()) {
            return "";
        }
        return "WHERE " + metric.getConditions().stream()
                .map(c -> condition(c, alias))
                .collect(Collectors.joining(" AND "));
    }

    static String condition(MetricCondition condition, String alias) {
        return alias + "." + condition.column() + " " + condition.operator() + " " + SqlLiterals.quote(condition.value());
    }
}
