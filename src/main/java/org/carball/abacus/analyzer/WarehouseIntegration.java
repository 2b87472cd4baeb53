package org.carball.abacus.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.abacus.config.SourceSettings;
import org.carball.abacus.dialect.SqlDialect;
import org.carball.abacus.execution.QueryRunner;
import org.carball.abacus.model.definition.DimensionDefinition;
import org.carball.abacus.model.definition.ExperimentDefinition;
import org.carball.abacus.model.definition.ExperimentPhase;
import org.carball.abacus.model.definition.MetricDefinition;
import org.carball.abacus.model.definition.SegmentDefinition;
import org.carball.abacus.model.query.MetricValueParams;
import org.carball.abacus.model.query.UsersQueryParams;
import org.carball.abacus.model.result.ExperimentResults;
import org.carball.abacus.model.result.ImpactEstimationResult;
import org.carball.abacus.model.result.MetricValueResult;
import org.carball.abacus.model.result.PastExperimentResult;
import org.carball.abacus.model.result.SourceProperties;
import org.carball.abacus.model.result.UsersResult;
import org.carball.abacus.parser.ResultParser;
import org.carball.abacus.query.QueryComposer;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point for one SQL source: composes queries in its dialect, runs them through its
 * runner and parses the rows.
 */
@Slf4j
public class WarehouseIntegration {

    private final SqlDialect dialect;
    private final QueryRunner runner;
    private final QueryComposer composer;
    private final ExperimentAnalyzer experimentAnalyzer;
    private final ImpactEstimator impactEstimator;

    public WarehouseIntegration(SourceSettings settings, SqlDialect dialect, QueryRunner runner, Clock clock) {
        this.dialect = dialect;
        this.runner = runner;
        this.composer = new QueryComposer(settings, dialect, clock);
        this.experimentAnalyzer = new ExperimentAnalyzer(settings, composer, runner);
        this.impactEstimator = new ImpactEstimator(composer, runner, clock);

        log.info("Initialized {} integration", dialect.name());
    }

    public SourceProperties getSourceProperties() {
        return SourceProperties.sql();
    }

    public QueryComposer getComposer() {
        return composer;
    }

    /**
     * Runs {@code select 1}. Failures surface as the runner's exception.
     */
    public boolean testConnection() {
        try {
            runner.run("select 1").join();
            return true;
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    public String getUsersQuery(UsersQueryParams params) {
        return composer.usersQuery(params);
    }

    public CompletableFuture<UsersResult> runUsersQuery(String sql) {
        return runner.run(sql).thenApply(ResultParser::parseUsers);
    }

    public String getMetricValueQuery(MetricValueParams params) {
        return composer.metricValueQuery(params);
    }

    public CompletableFuture<MetricValueResult> runMetricValueQuery(String sql) {
        return runner.run(sql).thenApply(ResultParser::parseMetricValue);
    }

    public String getPastExperimentQuery(Instant from) {
        return composer.pastExperimentsQuery(from);
    }

    public CompletableFuture<PastExperimentResult> runPastExperimentQuery(String sql) {
        return runner.run(sql).thenApply(ResultParser::parsePastExperiments);
    }

    public CompletableFuture<ExperimentResults> getExperimentResults(ExperimentDefinition experiment,
                                                                     ExperimentPhase phase,
                                                                     List<MetricDefinition> metrics,
                                                                     MetricDefinition activationMetric,
                                                                     DimensionDefinition dimension) {
        return experimentAnalyzer.analyze(experiment, phase, metrics, activationMetric, dimension);
    }

    public CompletableFuture<ImpactEstimationResult> getImpactEstimation(String urlRegex, MetricDefinition metric,
                                                                         SegmentDefinition segment) {
        return impactEstimator.estimate(metric, urlRegex, segment);
    }

    public String getDialectName() {
        return dialect.name();
    }
}
