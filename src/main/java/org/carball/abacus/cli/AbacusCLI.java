package org.carball.abacus.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.abacus.analyzer.WarehouseIntegration;
import org.carball.abacus.config.AnalysisRequest;
import org.carball.abacus.config.ConfigurationLoader;
import org.carball.abacus.config.OutputFormat;
import org.carball.abacus.config.SourceSettings;
import org.carball.abacus.dialect.DialectType;
import org.carball.abacus.dialect.SqlDialect;
import org.carball.abacus.execution.JdbcQueryRunner;
import org.carball.abacus.execution.QueryExecutionException;
import org.carball.abacus.execution.QueryRunner;
import org.carball.abacus.execution.RowFileQueryRunner;
import org.carball.abacus.model.definition.ExperimentDefinition;
import org.carball.abacus.model.definition.ExperimentPhase;
import org.carball.abacus.model.definition.MetricDefinition;
import org.carball.abacus.model.result.ExperimentResults;
import org.carball.abacus.model.result.ImpactEstimationResult;
import org.carball.abacus.model.result.PastExperimentResult;
import org.carball.abacus.output.ResultsReport;
import org.carball.abacus.query.QueryComposer;
import org.carball.abacus.query.QueryFormatter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
public class AbacusCLI {

    private static final String VERSION = "1.0.0";
    private static final String DEFAULT_DIALECT = "postgres";
    private static final int JDBC_THREADS = 4;

    private final Clock clock;
    private final PrintStream out;
    private final PrintStream err;

    public AbacusCLI(Clock clock, PrintStream out, PrintStream err) {
        this.clock = clock;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new AbacusCLI(Clock.systemUTC(), System.out, System.err).run(args));
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int run(String[] args) {
        if (isHelpRequested(args)) {
            printUsage();
            return 0;
        }
        if (args.length < 2) {
            printUsage();
            return 1;
        }

        ExecutorService executor = null;
        try {
            Options options = parseArgs(args);
            AnalysisRequest request = new ConfigurationLoader().loadRequest(options.requestFile);
            SourceSettings settings = new ConfigurationLoader().loadSettings(options.settingsFile);
            SqlDialect dialect = DialectType.fromName(options.dialect).create(options.dialectOptions);

            QueryRunner runner;
            if (options.dryRun) {
                runner = sql -> {
                    throw new IllegalStateException("Dry runs do not execute queries");
                };
            } else if (options.jdbcUrl != null) {
                executor = Executors.newFixedThreadPool(JDBC_THREADS);
                runner = new JdbcQueryRunner(options.jdbcUrl, executor);
            } else {
                runner = new RowFileQueryRunner(options.rowsFile);
            }

            WarehouseIntegration integration = new WarehouseIntegration(settings, dialect, runner, clock);
            String output = options.dryRun
                    ? composeOnly(options.command, request, integration.getComposer())
                    : execute(options, request, integration);

            if (options.outputFile != null) {
                Files.writeString(options.outputFile, output);
                out.println("Results written to " + options.outputFile);
            } else {
                out.println(output);
            }
            return 0;

        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (QueryExecutionException e) {
            err.println("Query error: " + e.getMessage());
            log.debug("Query error details", e);
            return 2;
        } finally {
            if (executor != null) {
                executor.shutdown();
            }
        }
    }

    private String execute(Options options, AnalysisRequest request, WarehouseIntegration integration) {
        ResultsReport report = new ResultsReport(clock);
        try {
            switch (options.command) {
                case "experiment" -> {
                    ExperimentDefinition experiment = requireExperiment(request);
                    ExperimentResults results = integration.getExperimentResults(
                            experiment, phase(experiment, request), request.getMetrics(),
                            request.getActivationMetric(), request.getDimension()).join();
                    return options.format == OutputFormat.JSON
                            ? report.toJson("experiment", results)
                            : report.toMarkdown(results);
                }
                case "impact" -> {
                    ImpactEstimationResult impact = integration.getImpactEstimation(
                            request.getUrlRegex(), requireMetric(request), request.getSegment()).join();
                    return options.format == OutputFormat.JSON
                            ? report.toJson("impact", impact)
                            : report.toMarkdown(impact);
                }
                default -> {
                    String sql = integration.getPastExperimentQuery(requireFrom(request));
                    PastExperimentResult past = integration.runPastExperimentQuery(sql).join();
                    return options.format == OutputFormat.JSON
                            ? report.toJson("past", past)
                            : report.toMarkdown(past);
                }
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof QueryExecutionException cause) {
                throw cause;
            }
            throw new QueryExecutionException("Analysis failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private static String composeOnly(String command, AnalysisRequest request, QueryComposer composer) {
        List<String> queries = new ArrayList<>();
        switch (command) {
            case "experiment" -> {
                ExperimentDefinition experiment = requireExperiment(request);
                ExperimentPhase phase = phase(experiment, request);
                queries.add(composer.experimentUsersQuery(
                        experiment, phase, request.getActivationMetric(), request.getDimension()));
                for (MetricDefinition metric : request.getMetrics()) {
                    queries.add(composer.experimentMetricQuery(
                            metric, experiment, phase, request.getActivationMetric(), request.getDimension()));
                }
            }
            case "impact" -> throw new IllegalArgumentException("--dry-run is not supported for impact estimates");
            default -> queries.add(composer.pastExperimentsQuery(requireFrom(request)));
        }
        return QueryFormatter.audit(queries);
    }

    private static ExperimentDefinition requireExperiment(AnalysisRequest request) {
        if (request.getExperiment() == null) {
            throw new IllegalArgumentException("Request has no experiment");
        }
        return request.getExperiment();
    }

    private static ExperimentPhase phase(ExperimentDefinition experiment, AnalysisRequest request) {
        return request.getPhase() < 0 ? experiment.latestPhase() : experiment.phase(request.getPhase());
    }

    private static MetricDefinition requireMetric(AnalysisRequest request) {
        if (request.getMetric() == null) {
            throw new IllegalArgumentException("Request has no metric");
        }
        return request.getMetric();
    }

    private static Instant requireFrom(AnalysisRequest request) {
        if (request.getFrom() == null) {
            throw new IllegalArgumentException("Request has no 'from' date");
        }
        return request.getFrom();
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private void printUsage() {
        out.println("abacus " + VERSION);
        out.println();
        out.println("Usage: java -jar abacus.jar <experiment|impact|past> <request.yml> [options]");
        out.println();
        out.println("Options:");
        out.println("  --settings, -s      YAML file with table and column settings (default: built-in)");
        out.println("  --dialect, -d       SQL dialect: " + DialectType.getAvailableDialects()
                + " (default: " + DEFAULT_DIALECT + ")");
        out.println("  --dialect-option    Dialect parameter as key=value, e.g. projectId=my-project");
        out.println("  --jdbc-url          JDBC URL of the warehouse to query");
        out.println("  --rows              JSON file with canned rows to replay instead of querying");
        out.println("  --output, -o        Output file (default: standard output)");
        out.println("  --format, -f        Output format: json|markdown (default: json)");
        out.println("  --dry-run           Print the composed SQL without running it");
        out.println("  --help, -h          Show this help message");
    }

    static Options parseArgs(String[] args) {
        Options options = new Options();
        options.command = args[0].toLowerCase();
        if (!List.of("experiment", "impact", "past").contains(options.command)) {
            throw new IllegalArgumentException("Unknown command: " + args[0] + ". Use experiment, impact or past");
        }
        options.requestFile = Paths.get(args[1]);

        for (int i = 2; i < args.length; i++) {
            switch (args[i]) {
                case "--settings", "-s" -> options.settingsFile = Paths.get(value(args, ++i, "Settings file"));
                case "--dialect", "-d" -> options.dialect = value(args, ++i, "Dialect");
                case "--dialect-option" -> {
                    String option = value(args, ++i, "Dialect option");
                    int eq = option.indexOf('=');
                    if (eq <= 0) {
                        throw new IllegalArgumentException("Dialect options must look like key=value: " + option);
                    }
                    options.dialectOptions.put(option.substring(0, eq), option.substring(eq + 1));
                }
                case "--jdbc-url" -> options.jdbcUrl = value(args, ++i, "JDBC URL");
                case "--rows" -> options.rowsFile = Paths.get(value(args, ++i, "Rows file"));
                case "--output", "-o" -> options.outputFile = Paths.get(value(args, ++i, "Output file"));
                case "--format", "-f" -> {
                    String format = value(args, ++i, "Output format");
                    try {
                        options.format = OutputFormat.valueOf(format.toUpperCase());
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format: " + format + ". Use: json or markdown");
                    }
                }
                case "--dry-run" -> options.dryRun = true;
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (!options.dryRun && options.jdbcUrl == null && options.rowsFile == null) {
            throw new IllegalArgumentException("Either --jdbc-url or --rows is required unless --dry-run is given");
        }
        if (options.jdbcUrl != null && options.rowsFile != null) {
            throw new IllegalArgumentException("Use only one of --jdbc-url and --rows");
        }
        return options;
    }

    private static String value(String[] args, int index, String what) {
        if (index >= args.length) {
            throw new IllegalArgumentException(what + " not specified");
        }
        return args[index];
    }

    static class Options {
        String command;
        Path requestFile;
        Path settingsFile;
        String dialect = DEFAULT_DIALECT;
        Map<String, String> dialectOptions = new HashMap<>();
        String jdbcUrl;
        Path rowsFile;
        Path outputFile;
        OutputFormat format = OutputFormat.JSON;
        boolean dryRun;
    }
}
