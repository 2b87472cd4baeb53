package org.carball.abacus.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.abacus.execution.QueryRunner;
import org.carball.abacus.model.definition.MetricDefinition;
import org.carball.abacus.model.definition.SegmentDefinition;
import org.carball.abacus.model.query.MetricValueParams;
import org.carball.abacus.model.query.UsersQueryParams;
import org.carball.abacus.model.result.ImpactEstimationResult;
import org.carball.abacus.model.result.MetricValueResult;
import org.carball.abacus.model.result.UsersResult;
import org.carball.abacus.parser.ResultParser;
import org.carball.abacus.query.QueryComposer;
import org.carball.abacus.query.QueryFormatter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Projects the daily traffic and metric value an experiment on some pages could affect,
 * from the last 30 settled days.
 */
@Slf4j
public class ImpactEstimator {

    static final int LOOKBACK_DAYS = 30;
    static final int SETTLE_DAYS = 3;
    static final int CONVERSION_WINDOW_DAYS = 3;

    private final QueryComposer composer;
    private final QueryRunner runner;
    private final Clock clock;

    public ImpactEstimator(QueryComposer composer, QueryRunner runner, Clock clock) {
        this.composer = composer;
        this.runner = runner;
        this.clock = clock;
    }

    public CompletableFuture<ImpactEstimationResult> estimate(MetricDefinition metric, String urlRegex,
                                                              SegmentDefinition segment) {
        Instant now = clock.instant();
        Instant end = now.minus(Duration.ofDays(SETTLE_DAYS));
        Instant start = end.minus(Duration.ofDays(LOOKBACK_DAYS));

        String usersSql = composer.usersQuery(UsersQueryParams.builder()
                .name("Traffic - Selected Pages and Segment")
                .from(start)
                .to(end)
                .urlRegex(urlRegex)
                .segment(segment)
                .userIdType(metric.getUserIdType())
                .conversionWindowDays(CONVERSION_WINDOW_DAYS)
                .build());
        MetricValueParams siteWide = MetricValueParams.builder()
                .name("Metric Value - Entire Site")
                .from(start)
                .to(end)
                .metric(metric)
                .userIdType(metric.getUserIdType())
                .conversionWindowDays(CONVERSION_WINDOW_DAYS)
                .build();
        String metricSql = composer.metricValueQuery(siteWide);
        String valueSql = composer.metricValueQuery(siteWide.toBuilder()
                .name("Metric Value - Selected Pages and Segment")
                .urlRegex(urlRegex)
                .segment(segment)
                .build());

        String query = QueryFormatter.audit(List.of(usersSql, metricSql, valueSql));
        CompletableFuture<List<Map<String, String>>> users = runner.run(usersSql);
        CompletableFuture<List<Map<String, String>>> metricTotal = runner.run(metricSql);
        CompletableFuture<List<Map<String, String>>> value = runner.run(valueSql);

        return CompletableFuture.allOf(users, metricTotal, value)
                .thenApply(ignored -> project(query, users.join(), metricTotal.join(), value.join()));
    }

    static ImpactEstimationResult project(String query, List<Map<String, String>> userRows,
                                          List<Map<String, String>> metricRows,
                                          List<Map<String, String>> valueRows) {
        if (userRows.isEmpty() || metricRows.isEmpty() || valueRows.isEmpty()) {
            log.info("Impact estimation found no data, reporting zeros");
            return ImpactEstimationResult.empty(query);
        }
        UsersResult users = ResultParser.parseUsers(userRows);
        MetricValueResult metricTotal = ResultParser.parseMetricValue(metricRows);
        MetricValueResult value = ResultParser.parseMetricValue(valueRows);

        return new ImpactEstimationResult(
                query,
                (double) users.getUsers() / LOOKBACK_DAYS,
                total(value) / LOOKBACK_DAYS,
                total(metricTotal) / LOOKBACK_DAYS);
    }

    private static double total(MetricValueResult result) {
        return result.getCount() * result.getMean();
    }
}
