package org.carball.abacus.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.abacus.model.result.DimensionResult;
import org.carball.abacus.model.result.ExperimentResults;
import org.carball.abacus.model.result.ImpactEstimationResult;
import org.carball.abacus.model.result.PastExperiment;
import org.carball.abacus.model.result.PastExperimentResult;
import org.carball.abacus.model.result.VariationMetricResult;
import org.carball.abacus.model.result.VariationResult;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders analysis results as JSON or as Markdown tables.
 */
@Slf4j
public class ResultsReport {

    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public ResultsReport(Clock clock) {
        this.timestamp = LocalDateTime.now(clock);

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson(String kind, Object result) {
        try {
            return objectMapper.writeValueAsString(new ReportData(kind, timestamp, result));
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown(ExperimentResults results) {
        StringBuilder md = header("Experiment Results");

        for (DimensionResult dimension : results.results()) {
            String name = dimension.dimension().isEmpty() ? "All users" : dimension.dimension();
            md.append("## ").append(name).append("\n\n");
            md.append("| Variation | Users | Metric | Count | Mean | Std Dev |\n");
            md.append("|-----------|-------|--------|-------|------|---------|\n");
            for (VariationResult variation : dimension.variations()) {
                if (variation.getMetrics().isEmpty()) {
                    md.append(row(variation.getVariation(), variation.getUsers(), "-", "-", "-", "-"));
                }
                for (VariationMetricResult metric : variation.getMetrics()) {
                    md.append(row(variation.getVariation(), variation.getUsers(), metric.metric(),
                            metric.count(), format(metric.mean()), format(metric.stddev())));
                }
            }
            md.append("\n");
        }

        appendQuery(md, results.query());
        return md.toString();
    }

    public String toMarkdown(ImpactEstimationResult impact) {
        StringBuilder md = header("Impact Estimate");
        md.append("Daily averages over the last 30 settled days.\n\n");
        md.append("| Measure | Per Day |\n");
        md.append("|---------|---------|\n");
        md.append("| Users on selected pages | ").append(format(impact.users())).append(" |\n");
        md.append("| Metric value on selected pages | ").append(format(impact.value())).append(" |\n");
        md.append("| Metric value site-wide | ").append(format(impact.metricTotal())).append(" |\n\n");

        appendQuery(md, impact.query());
        return md.toString();
    }

    public String toMarkdown(PastExperimentResult past) {
        StringBuilder md = header("Past Experiments");
        List<PastExperiment> experiments = past.experiments();
        if (experiments.isEmpty()) {
            md.append("No past experiments found.\n");
            return md.toString();
        }
        md.append("| Experiment | Variation | Start | End | Users |\n");
        md.append("|------------|-----------|-------|-----|-------|\n");
        for (PastExperiment experiment : experiments) {
            md.append(row(experiment.experimentId(), experiment.variationId(),
                    experiment.startDate(), experiment.endDate(), experiment.users()));
        }
        return md.toString();
    }

    private StringBuilder header(String title) {
        StringBuilder md = new StringBuilder();
        md.append("# ").append(title).append("\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n\n");
        return md;
    }

    private static void appendQuery(StringBuilder md, String query) {
        md.append("## Query\n\n```sql\n").append(query).append("\n```\n");
    }

    private static String row(Object... cells) {
        StringBuilder sb = new StringBuilder("|");
        for (Object cell : cells) {
            sb.append(' ').append(cell).append(" |");
        }
        return sb.append('\n').toString();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    record ReportData(String kind, LocalDateTime generated, Object result) {}
}
