package org.carball.abacus.config;

import lombok.Builder;
import lombok.Value;
import org.carball.abacus.model.definition.MetricDefinition;

/**
 * Resolved table and column names of one SQL source. Built once by {@link SettingsResolver},
 * every value is populated and the instance is safe to share between concurrent analyses.
 */
@Value
@Builder
public class SourceSettings {
    TableSettings defaults;
    TableSettings experiments;
    TableSettings users;
    TableSettings pageviews;
    TableSettings identifies;

    String experimentIdColumn;
    String variationColumn;
    VariationFormat variationFormat;
    String urlColumn;

    public static SourceSettings defaultSettings() {
        return SettingsResolver.resolve(null);
    }

    public TableSettings section(LogicalTable table) {
        return switch (table) {
            case DEFAULT -> defaults;
            case EXPERIMENTS -> experiments;
            case USERS -> users;
            case PAGEVIEWS -> pageviews;
            case IDENTIFIES -> identifies;
        };
    }

    public String table(LogicalTable table) {
        if (table == LogicalTable.DEFAULT) {
            throw new IllegalArgumentException("The default section does not name a table");
        }
        return section(table).getTable();
    }

    public String columnFor(LogicalTable table, ColumnRole role) {
        return section(table).column(role);
    }

    /**
     * Column lookup honouring a metric's own override before the section setting.
     */
    public String columnFor(LogicalTable table, ColumnRole role, MetricDefinition metric) {
        if (metric != null) {
            String override = switch (role) {
                case USER_ID -> metric.getUserIdColumn();
                case ANONYMOUS_ID -> metric.getAnonymousIdColumn();
                case TIMESTAMP -> metric.getTimestampColumn();
            };
            if (override != null && !override.isBlank()) {
                return override;
            }
        }
        return columnFor(table, role);
    }
}
