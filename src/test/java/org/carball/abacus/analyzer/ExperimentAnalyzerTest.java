package org.carball.abacus.analyzer;

import org.carball.abacus.config.RawSourceSettings;
import org.carball.abacus.config.RawTableSettings;
import org.carball.abacus.config.SettingsResolver;
import org.carball.abacus.config.SourceSettings;
import org.carball.abacus.dialect.RedshiftDialect;
import org.carball.abacus.execution.QueryExecutionException;
import org.carball.abacus.execution.QueryRunner;
import org.carball.abacus.model.definition.ExperimentDefinition;
import org.carball.abacus.model.definition.ExperimentPhase;
import org.carball.abacus.model.definition.MetricDefinition;
import org.carball.abacus.model.definition.MetricType;
import org.carball.abacus.model.result.DimensionResult;
import org.carball.abacus.model.result.ExperimentResults;
import org.carball.abacus.model.result.VariationMetricResult;
import org.carball.abacus.model.result.VariationResult;
import org.carball.abacus.query.QueryComposer;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.*;

class ExperimentAnalyzerTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private final SourceSettings settings = SourceSettings.defaultSettings();
    private final QueryComposer composer = new QueryComposer(
            settings, new RedshiftDialect(), Clock.fixed(START, ZoneOffset.UTC));

    private final ExperimentDefinition experiment = ExperimentDefinition.builder()
            .trackingKey("checkout")
            .variations(List.of("control", "treatment", "bold"))
            .phases(List.of(ExperimentPhase.running(START)))
            .build();

    private final MetricDefinition purchased = metric("met_purchased", "Purchased", MetricType.BINOMIAL, null);
    private final MetricDefinition revenue = metric("met_revenue", "Revenue", MetricType.REVENUE, "amount");

    /**
     * Hands out one manually completed future per query, keyed by the query's leading label.
     */
    private static class ControlledRunner implements QueryRunner {
        private final Map<String, CompletableFuture<List<Map<String, String>>>> futures = new LinkedHashMap<>();
        private final List<String> queries = new ArrayList<>();

        @Override
        public CompletableFuture<List<Map<String, String>>> run(String sql) {
            queries.add(sql);
            return futures.computeIfAbsent(sql.lines().findFirst().orElse(""), key -> new CompletableFuture<>());
        }

        void complete(String label, List<Map<String, String>> rows) {
            futures.get(label).complete(rows);
        }

        void fail(String label, RuntimeException failure) {
            futures.get(label).completeExceptionally(failure);
        }
    }

    @Test
    void shouldMergeUsersAndMetricsIntoVariationBuckets() {
        ControlledRunner runner = new ControlledRunner();
        CompletableFuture<ExperimentResults> future = analyzer(runner).analyze(
                experiment, experiment.latestPhase(), List.of(purchased, revenue), null, null);

        runner.complete("-- Number of users in experiment", List.of(
                row("0", "All", "users", "100"),
                row("1", "All", "users", "98")));
        runner.complete("-- Purchased (binomial)", List.of(
                metricRow("0", "All", "20", "1", "0"),
                metricRow("1", "All", "25", "1", "0")));
        runner.complete("-- Revenue (revenue)", List.of(
                metricRow("1", "All", "25", "42.5", "3.5")));

        ExperimentResults results = future.join();

        assertThat(results.results()).singleElement().satisfies(dimension -> {
            assertThat(dimension.dimension()).isEqualTo("All");
            assertThat(dimension.variations()).extracting(VariationResult::getUsers).containsExactly(100L, 98L, 0L);
            assertThat(dimension.variations().get(0).getMetrics())
                    .containsExactly(new VariationMetricResult("met_purchased", 20, 1, 0));
            assertThat(dimension.variations().get(1).getMetrics()).containsExactly(
                    new VariationMetricResult("met_purchased", 25, 1, 0),
                    new VariationMetricResult("met_revenue", 25, 42.5, 3.5));
            assertThat(dimension.variations().get(2).getMetrics()).isEmpty();
        });
        assertThat(results.query())
                .startsWith("-- Number of users in experiment")
                .contains(";\n\n-- Purchased (binomial)")
                .contains(";\n\n-- Revenue (revenue)")
                .endsWith(";");
    }

    @Test
    void shouldProduceSameBucketsWhateverTheCompletionOrder() {
        List<Map<String, String>> users = List.of(row("0", "US", "users", "10"), row("1", "US", "users", "12"));
        List<Map<String, String>> purchases = List.of(metricRow("0", "US", "3", "1", "0"));
        List<Map<String, String>> revenues = List.of(metricRow("0", "US", "3", "20", "5"));

        ControlledRunner first = new ControlledRunner();
        CompletableFuture<ExperimentResults> inOrder = analyzer(first).analyze(
                experiment, experiment.latestPhase(), List.of(purchased, revenue), null, null);
        first.complete("-- Purchased (binomial)", purchases);
        first.complete("-- Revenue (revenue)", revenues);
        first.complete("-- Number of users in experiment", users);

        ControlledRunner second = new ControlledRunner();
        CompletableFuture<ExperimentResults> reversed = analyzer(second).analyze(
                experiment, experiment.latestPhase(), List.of(purchased, revenue), null, null);
        second.complete("-- Revenue (revenue)", revenues);
        second.complete("-- Number of users in experiment", users);
        second.complete("-- Purchased (binomial)", purchases);

        assertThat(reversed.join()).isEqualTo(inOrder.join());
        assertThat(inOrder.join().dimension("US").orElseThrow().variations().get(0).getMetrics())
                .extracting(VariationMetricResult::metric)
                .containsExactly("met_purchased", "met_revenue");
    }

    @Test
    void shouldKeepDimensionsApartAndDropUnknownVariations() {
        SourceSettings keyed = SettingsResolver.resolve(RawSourceSettings.builder()
                .experiments(RawTableSettings.builder().variationFormat("key").build())
                .build());
        ExperimentAnalyzer analyzer = new ExperimentAnalyzer(keyed, composer, sql -> null);

        List<DimensionResult> results = analyzer.merge(experiment, List.of(purchased),
                List.of(
                        row("control", "US", "users", "5"),
                        row("bold", "CA", "users", "7"),
                        row("purple", "US", "users", "99")),
                List.of(List.of(metricRow("treatment", "CA", "2", "1", "0"))));

        assertThat(results).extracting(DimensionResult::dimension).containsExactly("US", "CA");
        DimensionResult canada = results.get(1);
        assertThat(canada.variations()).hasSize(3);
        assertThat(canada.variations().get(2).getUsers()).isEqualTo(7);
        assertThat(canada.variations().get(1).getUsers()).isZero();
        assertThat(canada.variations().get(1).getMetrics()).hasSize(1);
        assertThat(results.get(0).variations()).extracting(VariationResult::getUsers).containsExactly(5L, 0L, 0L);
    }

    @Test
    void shouldTreatMissingDimensionAsEmpty() {
        List<DimensionResult> results = analyzer(new ControlledRunner()).merge(
                experiment, List.of(), List.of(Map.of("variation", "0", "users", "4")), List.of());

        assertThat(results).singleElement().satisfies(d -> assertThat(d.dimension()).isEmpty());
    }

    @Test
    void shouldFailWholeAnalysisWhenOneQueryFails() {
        ControlledRunner runner = new ControlledRunner();
        CompletableFuture<ExperimentResults> future = analyzer(runner).analyze(
                experiment, experiment.latestPhase(), List.of(purchased, revenue), null, null);

        runner.complete("-- Number of users in experiment", List.of(row("0", "All", "users", "1")));
        runner.fail("-- Revenue (revenue)", new QueryExecutionException("warehouse unavailable"));
        assertThat(future).isNotDone();
        runner.complete("-- Purchased (binomial)", List.of());

        assertThatThrownBy(future::join)
                .isInstanceOf(CompletionException.class)
                .hasRootCauseInstanceOf(QueryExecutionException.class)
                .hasRootCauseMessage("warehouse unavailable");
    }

    @Test
    void shouldIssueOneQueryPerMetricPlusUsers() {
        ControlledRunner runner = new ControlledRunner();

        analyzer(runner).analyze(experiment, experiment.latestPhase(), List.of(purchased, revenue), null, null);

        assertThat(runner.queries).hasSize(3);
    }

    private ExperimentAnalyzer analyzer(QueryRunner runner) {
        return new ExperimentAnalyzer(settings, composer, runner);
    }

    private static MetricDefinition metric(String id, String name, MetricType type, String column) {
        return MetricDefinition.builder().id(id).name(name).type(type).table("purchases").column(column).build();
    }

    private static Map<String, String> row(String variation, String dimension, String column, String value) {
        return Map.of("variation", variation, "dimension", dimension, column, value);
    }

    private static Map<String, String> metricRow(String variation, String dimension,
                                                 String count, String mean, String stddev) {
        return Map.of("variation", variation, "dimension", dimension,
                "count", count, "mean", mean, "stddev", stddev);
    }
}
