package org.carball.abacus.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.abacus.config.SourceSettings;
import org.carball.abacus.execution.QueryRunner;
import org.carball.abacus.model.definition.DimensionDefinition;
import org.carball.abacus.model.definition.ExperimentDefinition;
import org.carball.abacus.model.definition.ExperimentPhase;
import org.carball.abacus.model.definition.MetricDefinition;
import org.carball.abacus.model.result.DimensionResult;
import org.carball.abacus.model.result.ExperimentResults;
import org.carball.abacus.model.result.VariationMetricResult;
import org.carball.abacus.model.result.VariationResult;
import org.carball.abacus.parser.ResultParser;
import org.carball.abacus.parser.VariationResolver;
import org.carball.abacus.query.QueryComposer;
import org.carball.abacus.query.QueryFormatter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the users query and one query per metric concurrently, then merges the rows into
 * per dimension, per variation buckets. Either every query succeeds or the whole analysis
 * fails with the first failure.
 */
@Slf4j
public class ExperimentAnalyzer {

    static final String NO_DIMENSION = "";

    private final SourceSettings settings;
    private final QueryComposer composer;
    private final QueryRunner runner;

    public ExperimentAnalyzer(SourceSettings settings, QueryComposer composer, QueryRunner runner) {
        this.settings = settings;
        this.composer = composer;
        this.runner = runner;
    }

    public CompletableFuture<ExperimentResults> analyze(ExperimentDefinition experiment, ExperimentPhase phase,
                                                        List<MetricDefinition> metrics,
                                                        MetricDefinition activationMetric,
                                                        DimensionDefinition dimension) {
        log.info("Analyzing experiment {} with {} metrics", experiment.getTrackingKey(), metrics.size());

        List<String> queries = new ArrayList<>();
        queries.add(composer.experimentUsersQuery(experiment, phase, activationMetric, dimension));
        for (MetricDefinition metric : metrics) {
            queries.add(composer.experimentMetricQuery(metric, experiment, phase, activationMetric, dimension));
        }

        List<CompletableFuture<List<Map<String, String>>>> branches = queries.stream()
                .map(runner::run)
                .toList();

        return CompletableFuture.allOf(branches.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, failure) -> {
                    if (failure != null) {
                        log.error("Analysis of experiment {} failed: {}",
                                experiment.getTrackingKey(), failure.getMessage());
                    }
                })
                .thenApply(ignored -> {
                    List<List<Map<String, String>>> metricRows = branches.subList(1, branches.size()).stream()
                            .map(CompletableFuture::join)
                            .toList();
                    List<DimensionResult> results = merge(
                            experiment, metrics, branches.get(0).join(), metricRows);
                    log.info("Experiment {} produced {} dimension buckets",
                            experiment.getTrackingKey(), results.size());
                    return new ExperimentResults(results, QueryFormatter.audit(queries));
                });
    }

    /**
     * Folds users rows, then each metric's rows in metric order, into dimension buckets.
     * Every dimension gets one bucket per declared variation.
     */
    List<DimensionResult> merge(ExperimentDefinition experiment, List<MetricDefinition> metrics,
                                List<Map<String, String>> userRows,
                                List<List<Map<String, String>>> metricRows) {
        VariationResolver resolver = new VariationResolver(settings.getVariationFormat(), experiment.getVariations());
        Map<String, List<VariationResult>> buckets = new LinkedHashMap<>();

        for (Map<String, String> row : userRows) {
            OptionalInt variation = resolver.resolve(row.get("variation"));
            if (variation.isPresent()) {
                bucket(buckets, row, experiment.variationCount())
                        .get(variation.getAsInt())
                        .setUsers(ResultParser.parseLong(row.get("users")));
            }
        }

        for (int i = 0; i < metrics.size(); i++) {
            MetricDefinition metric = metrics.get(i);
            for (Map<String, String> row : metricRows.get(i)) {
                OptionalInt variation = resolver.resolve(row.get("variation"));
                if (variation.isEmpty()) {
                    continue;
                }
                bucket(buckets, row, experiment.variationCount())
                        .get(variation.getAsInt())
                        .getMetrics()
                        .add(new VariationMetricResult(
                                metric.getId(),
                                ResultParser.parseLong(row.get("count")),
                                ResultParser.parseDouble(row.get("mean")),
                                ResultParser.parseDouble(row.get("stddev"))));
            }
        }

        return buckets.entrySet().stream()
                .map(entry -> new DimensionResult(entry.getKey(), List.copyOf(entry.getValue())))
                .toList();
    }

    private static List<VariationResult> bucket(Map<String, List<VariationResult>> buckets,
                                                 Map<String, String> row, int variationCount) {
        String dimension = row.getOrDefault("dimension", NO_DIMENSION);
        return buckets.computeIfAbsent(dimension, key -> {
            List<VariationResult> variations = new ArrayList<>(variationCount);
            for (int i = 0; i < variationCount; i++) {
                variations.add(new VariationResult(i));
            }
            return variations;
        });
    }
}
