package org.carball.abacus.query;

import org.carball.abacus.config.ColumnRole;
import org.carball.abacus.config.LogicalTable;
import org.carball.abacus.config.SourceSettings;
import org.carball.abacus.dialect.SqlDialect;
import org.carball.abacus.dialect.SqlLiterals;
import org.carball.abacus.model.definition.DimensionDefinition;
import org.carball.abacus.model.definition.ExperimentDefinition;
import org.carball.abacus.model.definition.ExperimentPhase;
import org.carball.abacus.model.definition.IdentifierType;
import org.carball.abacus.model.definition.MetricDefinition;
import org.carball.abacus.model.definition.SegmentDefinition;
import org.carball.abacus.model.query.PageQueryParams;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.carball.abacus.query.QueryFormatter.nest;

/**
 * Builders for the derived tables the composed queries are assembled from. Each returns the
 * body of one CTE, labelled with a leading {@code --} comment, exposing {@code user_id} in the
 * requested identifier space.
 */
public class DerivedTables {

    static final String METRIC_ALIAS = "m";
    static final String EXPERIMENT_ALIAS = "e";
    static final String SEGMENT_ALIAS = "s";
    static final String DIMENSION_ALIAS = "d";

    private final SourceSettings settings;
    private final SqlDialect dialect;
    private final IdentityReconciler reconciler;

    public DerivedTables(SourceSettings settings, SqlDialect dialect) {
        this.settings = settings;
        this.dialect = dialect;
        this.reconciler = new IdentityReconciler(settings, dialect);
    }

    /**
     * First visit per user to pages matching the URL filter, between the start of the
     * {@code from} day and the start of the {@code to} day.
     */
    public String pageUsers(PageQueryParams params, IdentifierType requested) {
        String timestamp = settings.columnFor(LogicalTable.PAGEVIEWS, ColumnRole.TIMESTAMP);
        String userId = settings.columnFor(LogicalTable.PAGEVIEWS, ColumnRole.forIdentifier(requested));
        String firstVisit = "MIN(" + timestamp + ")";
        String urlFilter = params.hasUrlFilter()
                ? "AND " + dialect.matchesRegex(settings.getUrlColumn(), params.getUrlRegex())
                : "";

        return """
                -- Users visiting specific pages
                SELECT
                  %s as user_id,
                  %s as actual_start,
                  %s as conversion_end,
                  %s as session_start
                FROM
                  %s
                WHERE
                  %s >= %s
                  AND %s <= %s
                  %s
                GROUP BY
                  %s
                """.formatted(
                userId,
                firstVisit,
                dialect.addInterval(firstVisit, params.getConversionWindowDays()),
                dialect.subtractHalfHour(firstVisit),
                dialect.qualifyTable(settings.table(LogicalTable.PAGEVIEWS)),
                timestamp, dialect.formatTimestampLiteral(startOfDay(params.getFrom())),
                timestamp, dialect.formatTimestampLiteral(startOfDay(params.getTo())),
                urlFilter,
                userId);
    }

    public String segment(SegmentDefinition segment, IdentifierType requested) {
        String label = "Segment (" + segment.name() + ")";
        FragmentInspector.inspect(label, segment.sql(), FragmentInspector.SEGMENT_COLUMNS);

        IdentityColumn id = reconciler.reconcileFragment(requested, segment.userIdType(), SEGMENT_ALIAS);
        if (!id.isBridged()) {
            return "-- " + label + "\n" + segment.sql().strip() + "\n";
        }
        return """
                -- %s
                SELECT
                  %s as user_id,
                  s.date
                FROM
                  (
                    %s
                  ) s
                  %s
                """.formatted(label, id.column(), nest(segment.sql(), 4), nest(id.join(), 2));
    }

    public String dimension(DimensionDefinition dimension, IdentifierType requested) {
        String label = "Dimension (" + dimension.name() + ")";
        FragmentInspector.inspect(label, dimension.sql(), FragmentInspector.DIMENSION_COLUMNS);

        IdentityColumn id = reconciler.reconcileFragment(requested, dimension.userIdType(), DIMENSION_ALIAS);
        if (!id.isBridged()) {
            return "-- " + label + "\n" + dimension.sql().strip() + "\n";
        }
        return """
                -- %s
                SELECT
                  %s as user_id,
                  d.value
                FROM
                  (
                    %s
                  ) d
                  %s
                """.formatted(label, id.column(), nest(dimension.sql(), 4), nest(id.join(), 2));
    }

    /**
     * One row per metric event. The conversion window is the metric's own, or
     * {@code fallbackWindowHours} when the metric does not define one.
     */
    public String metric(MetricDefinition metric, int fallbackWindowHours, IdentifierType requested) {
        metric.validate();
        IdentityColumn id = reconciler.reconcile(
                requested, metric.getUserIdType(), METRIC_ALIAS, LogicalTable.DEFAULT, metric);
        String timestamp = METRIC_ALIAS + "." + settings.columnFor(LogicalTable.DEFAULT, ColumnRole.TIMESTAMP, metric);
        int window = metric.getConversionWindowHours() > 0 ? metric.getConversionWindowHours() : fallbackWindowHours;

        return """
                -- Metric (%s)
                SELECT
                  %s as user_id,
                  %s as value,
                  %s as actual_start,
                  %s as conversion_end,
                  %s as session_start
                FROM
                  %s m
                  %s
                %s
                """.formatted(
                metric.getName(),
                id.column(),
                MetricExpressions.rawValue(metric, METRIC_ALIAS),
                timestamp,
                dialect.addHours(timestamp, window),
                dialect.subtractHalfHour(timestamp),
                dialect.qualifyTable(metric.getTable()),
                nest(id.join(), 2),
                MetricExpressions.conditions(metric, METRIC_ALIAS));
    }

    /**
     * Assignment events of one experiment phase. An open phase has no upper bound.
     */
    public String experiment(ExperimentDefinition experiment, ExperimentPhase phase, IdentifierType requested) {
        IdentityColumn id = reconciler.reconcile(
                requested, experiment.getUserIdType(), EXPERIMENT_ALIAS, LogicalTable.EXPERIMENTS, null);
        String timestamp = EXPERIMENT_ALIAS + "." + settings.columnFor(LogicalTable.EXPERIMENTS, ColumnRole.TIMESTAMP);
        String upperBound = phase.end()
                .map(end -> "AND " + timestamp + " <= " + dialect.formatTimestampLiteral(end))
                .orElse("");

        return """
                -- Viewed Experiment
                SELECT
                  %s as user_id,
                  e.%s as variation,
                  %s as actual_start,
                  %s as conversion_end,
                  %s as session_start
                FROM
                  %s e
                  %s
                WHERE
                  e.%s = %s
                  AND %s >= %s
                  %s
                """.formatted(
                id.column(),
                settings.getVariationColumn(),
                timestamp,
                dialect.addHours(timestamp, experiment.getConversionWindowHours()),
                dialect.subtractHalfHour(timestamp),
                dialect.qualifyTable(settings.table(LogicalTable.EXPERIMENTS)),
                nest(id.join(), 2),
                settings.getExperimentIdColumn(), SqlLiterals.quote(experiment.getTrackingKey()),
                timestamp, dialect.formatTimestampLiteral(phase.dateStarted()),
                upperBound);
    }

    static Instant startOfDay(Instant instant) {
        return instant.truncatedTo(ChronoUnit.DAYS);
    }
}
