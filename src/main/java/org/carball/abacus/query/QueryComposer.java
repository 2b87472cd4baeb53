package org.carball.abacus.query;

import lombok.extern.slf4j.Slf4j;
import org.carball.abacus.config.ColumnRole;
import org.carball.abacus.config.LogicalTable;
import org.carball.abacus.config.SourceSettings;
import org.carball.abacus.dialect.SqlDialect;
import org.carball.abacus.model.definition.DimensionDefinition;
import org.carball.abacus.model.definition.ExperimentDefinition;
import org.carball.abacus.model.definition.ExperimentPhase;
import org.carball.abacus.model.definition.IdentifierType;
import org.carball.abacus.model.definition.MetricDefinition;
import org.carball.abacus.model.query.MetricValueParams;
import org.carball.abacus.model.query.PageQueryParams;
import org.carball.abacus.model.query.UsersQueryParams;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.carball.abacus.query.QueryFormatter.nest;

/**
 * Composes the complete SQL statements run against the warehouse. Composition is pure: the
 * only input besides the arguments is the clock, read when an open phase needs an end date.
 */
@Slf4j
public class QueryComposer {

    /** Percentiles reported by the metric value query, in percent. */
    public static final List<Integer> PERCENTILES = List.of(1, 5, 10, 20, 30, 40, 50, 60, 70, 80, 90, 95, 99);

    // Past experiment discovery heuristics
    static final double NOISE_THRESHOLD_RATIO = 0.05;
    static final int MIN_DAILY_USERS = 5;
    static final int MIN_TOTAL_USERS = 200;
    static final int MIN_DURATION_DAYS = 5;
    static final int MIN_DAYS_AFTER_HORIZON = 2;

    private static final String SEGMENT_JOIN =
            "JOIN __segment s ON (s.user_id = u.user_id AND s.date <= u.actual_start)";

    private final SourceSettings settings;
    private final SqlDialect dialect;
    private final DerivedTables tables;
    private final Clock clock;

    public QueryComposer(SourceSettings settings, SqlDialect dialect, Clock clock) {
        this.settings = settings;
        this.dialect = dialect;
        this.tables = new DerivedTables(settings, dialect);
        this.clock = clock;
    }

    /**
     * Distinct users visiting matching pages, optionally split by day.
     */
    public String usersQuery(UsersQueryParams params) {
        IdentifierType requested = params.getUserIdType();
        String segmentJoin = params.getSegment() != null ? SEGMENT_JOIN : "";

        StringBuilder sql = new StringBuilder();
        sql.append("-- ").append(params.getName()).append(" - Number of Users\n");
        appendPopulation(sql, params, requested);
        sql.append("""
                SELECT
                  %s
                  COUNT(DISTINCT u.user_id) as users
                FROM
                  __users u
                  %s
                """.formatted(params.isIncludeByDate() ? "null as date," : "", segmentJoin));

        if (params.isIncludeByDate()) {
            String day = dialect.truncateToDay("u.actual_start");
            sql.append("""
                    UNION ALL SELECT
                      %s as date,
                      COUNT(DISTINCT u.user_id) as users
                    FROM
                      __users u
                      %s
                    GROUP BY
                      %s
                    ORDER BY
                      date ASC
                    """.formatted(day, segmentJoin, day));
        }
        return finish(sql.toString());
    }

    /**
     * Count, mean, standard deviation and optionally percentiles of a metric over users
     * visiting matching pages.
     */
    public String metricValueQuery(MetricValueParams params) {
        MetricDefinition metric = params.getMetric();
        IdentifierType requested = params.getUserIdType();
        String segmentJoin = params.getSegment() != null ? SEGMENT_JOIN : "";
        String aggregate = MetricExpressions.aggregateValue(metric);

        StringBuilder sql = new StringBuilder();
        sql.append("-- ").append(params.getName()).append(" - ").append(metric.getName()).append(" Metric\n");
        appendPopulation(sql, params, requested);
        sql.append("""
                  , __metric as (
                    %s
                  )
                  , __distinctUsers as (
                    SELECT
                      u.user_id,
                      MIN(u.conversion_end) as conversion_end,
                      MIN(u.session_start) as session_start,
                      MIN(u.actual_start) as actual_start
                    FROM
                      __users u
                      %s
                    GROUP BY
                      u.user_id
                  )
                  , __userMetric as (
                    -- Add in the aggregate metric value for each user
                    SELECT
                      %s as value
                    FROM
                      __distinctUsers d
                      %s
                    GROUP BY
                      d.user_id
                  )
                """.formatted(
                nest(tables.metric(metric, params.getConversionWindowDays() * 24, requested), 4),
                segmentJoin,
                aggregate,
                nest(conversionJoin(metric, "d"), 6)));

        String day = dialect.truncateToDay("d.actual_start");
        if (params.isIncludeByDate()) {
            sql.append("""
                      , __userMetricDates as (
                        -- Add in the aggregate metric value for each user
                        SELECT
                          %s as date,
                          %s as value
                        FROM
                          __distinctUsers d
                          %s
                        GROUP BY
                          %s,
                          d.user_id
                      )
                    """.formatted(day, aggregate, nest(conversionJoin(metric, "d"), 6), day));
        }

        boolean percentiles = params.isIncludePercentiles() && metric.getType().hasDistribution();
        List<String> columns = new ArrayList<>();
        if (params.isIncludeByDate()) {
            columns.add("null as date");
        }
        columns.addAll(summaryColumns());
        if (percentiles) {
            PERCENTILES.forEach(p -> columns.add(dialect.percentileExpr("value", p / 100.0) + " as p" + p));
        }
        sql.append("""
                SELECT
                  %s
                FROM
                  __userMetric
                """.formatted(String.join(",\n  ", columns)));

        if (params.isIncludeByDate()) {
            List<String> dateColumns = new ArrayList<>();
            dateColumns.add("date");
            dateColumns.addAll(summaryColumns());
            if (percentiles) {
                PERCENTILES.forEach(p -> dateColumns.add("0 as p" + p));
            }
            sql.append("""
                    UNION ALL SELECT
                      %s
                    FROM
                      __userMetricDates d
                    GROUP BY
                      date
                    ORDER BY
                      date ASC
                    """.formatted(String.join(",\n  ", dateColumns)));
        }
        return finish(sql.toString());
    }

    /**
     * Distinct users per variation and dimension value, or the raw {@code users} override.
     */
    public String experimentUsersQuery(ExperimentDefinition experiment, ExperimentPhase phase,
                                       MetricDefinition activationMetric, DimensionDefinition dimension) {
        Optional<String> override = override(experiment, phase, ExperimentDefinition.USERS_OVERRIDE_KEY);
        if (override.isPresent()) {
            return override.get();
        }
        IdentifierType requested = experiment.getUserIdType();

        StringBuilder sql = new StringBuilder();
        sql.append("-- Number of users in experiment\n");
        appendExperimentTables(sql, experiment, phase, null, activationMetric, dimension, requested);
        sql.append("""
                  , __distinctUsers as (
                    -- One row per user/dimension/variation
                    SELECT
                      e.user_id,
                      e.variation,
                      %s as dimension
                    FROM
                      __experiment e
                      %s
                    GROUP BY
                      %s
                  )
                -- Count of distinct users in experiment per variation/dimension
                SELECT
                  variation,
                  dimension,
                  COUNT(*) as users
                FROM
                  __distinctUsers
                GROUP BY
                  variation,
                  dimension
                """.formatted(
                dimension != null ? "d.value" : "'All'",
                nest(experimentJoins(activationMetric, dimension), 6),
                distinctUsersGrouping(dimension)));
        return finish(sql.toString());
    }

    /**
     * Per variation and dimension value summary of one metric, or the metric's raw override.
     */
    public String experimentMetricQuery(MetricDefinition metric, ExperimentDefinition experiment,
                                        ExperimentPhase phase, MetricDefinition activationMetric,
                                        DimensionDefinition dimension) {
        Optional<String> override = override(experiment, phase, metric.getId());
        if (override.isPresent()) {
            return override.get();
        }
        IdentifierType requested = experiment.getUserIdType();
        String source = activationMetric != null ? "a" : "e";

        StringBuilder sql = new StringBuilder();
        sql.append("-- ").append(metric.getName()).append(" (").append(metric.getType().name().toLowerCase())
                .append(")\n");
        appendExperimentTables(sql, experiment, phase, metric, activationMetric, dimension, requested);
        sql.append("""
                  , __distinctUsers as (
                    -- One row per user/dimension/variation
                    SELECT
                      e.user_id,
                      e.variation,
                      %s as dimension,
                      MIN(%s.actual_start) as actual_start,
                      MIN(%s.session_start) as session_start,
                      MIN(%s.conversion_end) as conversion_end
                    FROM
                      __experiment e
                      %s
                    GROUP BY
                      %s
                  )
                  , __userMetric as (
                    -- Add in the aggregate metric value for each user
                    SELECT
                      d.variation,
                      d.dimension,
                      %s as value
                    FROM
                      __distinctUsers d
                      %s
                    GROUP BY
                      d.variation,
                      d.dimension,
                      d.user_id
                  )
                -- Sum all user metrics together to get a total per variation/dimension
                SELECT
                  variation,
                  dimension,
                  %s
                FROM
                  __userMetric
                GROUP BY
                  variation,
                  dimension
                """.formatted(
                dimension != null ? "d.value" : "'All'",
                source, source, source,
                nest(experimentJoins(activationMetric, dimension), 6),
                distinctUsersGrouping(dimension),
                MetricExpressions.aggregateValue(metric),
                nest(conversionJoin(metric, "d"), 6),
                String.join(",\n  ", summaryColumns())));
        return finish(sql.toString());
    }

    /**
     * Experiments and variations found in the assignment table since {@code from}, after
     * discarding trailing noise, short runs and runs truncated by the lookback horizon.
     */
    public String pastExperimentsQuery(Instant from) {
        String experimentId = settings.getExperimentIdColumn();
        String variation = settings.getVariationColumn();
        String timestamp = settings.columnFor(LogicalTable.EXPERIMENTS, ColumnRole.TIMESTAMP);
        String anonymousId = settings.columnFor(LogicalTable.EXPERIMENTS, ColumnRole.ANONYMOUS_ID);
        String day = dialect.truncateToDay(timestamp);
        String horizon = dialect.formatTimestampLiteral(from);

        String sql = """
                -- Past Experiments
                WITH
                  __experimentDates as (
                    SELECT
                      %s as experiment_id,
                      %s as variation_id,
                      %s as date,
                      count(distinct %s) as users
                    FROM
                      %s
                    WHERE
                      %s > %s
                    GROUP BY
                      %s,
                      %s,
                      %s
                  ),
                  __userThresholds as (
                    SELECT
                      experiment_id,
                      variation_id,
                      -- Tracking events trickle in long after an experiment ends, only keep days with real traffic
                      max(users)*%s as threshold
                    FROM
                      __experimentDates
                    WHERE
                      users > %d
                    GROUP BY
                      experiment_id, variation_id
                  ),
                  __variations as (
                    SELECT
                      d.experiment_id,
                      d.variation_id,
                      MIN(d.date) as start_date,
                      MAX(d.date) as end_date,
                      SUM(d.users) as users
                    FROM
                      __experimentDates d
                      JOIN __userThresholds u ON (
                        d.users > u.threshold
                        AND d.experiment_id = u.experiment_id
                        AND d.variation_id = u.variation_id
                      )
                    GROUP BY
                      d.experiment_id, d.variation_id
                  )
                SELECT
                  *
                FROM
                  __variations
                WHERE
                  users > %d
                  AND %s > %d
                  -- Runs starting right at the horizon are probably missing data
                  AND %s > %d
                ORDER BY
                  experiment_id ASC, variation_id ASC
                """.formatted(
                experimentId, variation, day, anonymousId,
                dialect.qualifyTable(settings.table(LogicalTable.EXPERIMENTS)),
                timestamp, horizon,
                experimentId, variation, day,
                NOISE_THRESHOLD_RATIO, MIN_DAILY_USERS,
                MIN_TOTAL_USERS,
                dialect.dateDiffDays("start_date", "end_date"), MIN_DURATION_DAYS,
                dialect.dateDiffDays(horizon, "start_date"), MIN_DAYS_AFTER_HORIZON);
        return finish(sql);
    }

    private void appendPopulation(StringBuilder sql, PageQueryParams params, IdentifierType requested) {
        sql.append("""
                WITH
                  __users as (
                    %s
                  )
                """.formatted(nest(tables.pageUsers(params, requested), 4)));
        if (params.getSegment() != null) {
            sql.append("""
                      , __segment as (
                        %s
                      )
                    """.formatted(nest(tables.segment(params.getSegment(), requested), 4)));
        }
    }

    private void appendExperimentTables(StringBuilder sql, ExperimentDefinition experiment, ExperimentPhase phase,
                                        MetricDefinition metric, MetricDefinition activationMetric,
                                        DimensionDefinition dimension, IdentifierType requested) {
        experiment.validate();
        int window = experiment.getConversionWindowHours();
        sql.append("""
                WITH
                  __experiment as (
                    %s
                  )
                """.formatted(nest(tables.experiment(experiment, phase, requested), 4)));
        if (metric != null) {
            appendCte(sql, "__metric", tables.metric(metric, window, requested));
        }
        if (dimension != null) {
            appendCte(sql, "__dimension", tables.dimension(dimension, requested));
        }
        if (activationMetric != null) {
            appendCte(sql, "__activationMetric", tables.metric(activationMetric, window, requested));
        }
    }

    private static void appendCte(StringBuilder sql, String name, String body) {
        sql.append("""
                  , %s as (
                    %s
                  )
                """.formatted(name, nest(body, 4)));
    }

    /**
     * Dimension join, then the activation join requiring the activation event inside the
     * assignment's conversion window.
     */
    private static String experimentJoins(MetricDefinition activationMetric, DimensionDefinition dimension) {
        List<String> joins = new ArrayList<>();
        if (dimension != null) {
            joins.add("JOIN __dimension d ON (d.user_id = e.user_id)");
        }
        if (activationMetric != null) {
            joins.add("""
                    JOIN __activationMetric a ON (
                      a.user_id = e.user_id
                      AND a.actual_start >= e.actual_start
                      AND a.actual_start <= e.conversion_end
                    )""");
        }
        return String.join("\n", joins);
    }

    private static String distinctUsersGrouping(DimensionDefinition dimension) {
        return dimension != null ? "e.variation, d.value, e.user_id" : "e.variation, e.user_id";
    }

    /**
     * Joins metric rows falling inside {@code [window start + delay, conversion end]} of the
     * population row aliased {@code alias}.
     */
    String conversionJoin(MetricDefinition metric, String alias) {
        String windowStart = alias + "." + (metric.isEarlyStart() ? "session_start" : "actual_start");
        if (metric.getConversionDelayHours() > 0) {
            windowStart = dialect.addHours(windowStart, metric.getConversionDelayHours());
        }
        return """
                JOIN __metric m ON (
                  m.user_id = %s.user_id
                  AND m.actual_start >= %s
                  AND m.actual_start <= %s.conversion_end
                )""".formatted(alias, windowStart, alias);
    }

    private List<String> summaryColumns() {
        return List.of(
                "COUNT(*) as count",
                "AVG(value) as mean",
                dialect.stddev("value") + " as stddev");
    }

    private Optional<String> override(ExperimentDefinition experiment, ExperimentPhase phase, String key) {
        return experiment.sqlOverride(key).map(template -> {
            log.debug("Using SQL override '{}' for experiment {}", key, experiment.getTrackingKey());
            return SqlOverrides.apply(template, phase, experiment.getTrackingKey(), dialect, clock.instant());
        });
    }

    private static String finish(String sql) {
        return QueryFormatter.format(sql);
    }
}
