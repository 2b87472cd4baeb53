package org.carball.abacus.dialect;

import java.time.Instant;

/**
 * Google BigQuery standard SQL. Unqualified table names are resolved against the
 * configured project and dataset.
 */
public class BigQueryDialect implements SqlDialect {

    private final String projectId;
    private final String dataset;

    public BigQueryDialect(String projectId, String dataset) {
        this.projectId = projectId;
        this.dataset = dataset;
    }

    @Override
    public String name() {
        return "bigquery";
    }

    @Override
    public String formatTimestampLiteral(Instant timestamp) {
        return "DATETIME \"" + TIMESTAMP_FORMAT.format(timestamp) + "\"";
    }

    @Override
    public String addInterval(String column, int days) {
        return "DATETIME_ADD(" + column + ", INTERVAL " + days + " DAY)";
    }

    @Override
    public String addHours(String column, int hours) {
        return "DATETIME_ADD(" + column + ", INTERVAL " + hours + " HOUR)";
    }

    @Override
    public String subtractMinutes(String column, int minutes) {
        return "DATETIME_SUB(" + column + ", INTERVAL " + minutes + " MINUTE)";
    }

    @Override
    public String matchesRegex(String column, String pattern) {
        return "REGEXP_CONTAINS(" + column + ", " + SqlLiterals.quoteWithBackslashEscapes(pattern) + ")";
    }

    @Override
    public String truncateToDay(String column) {
        return "date_trunc(" + column + ", DAY)";
    }

    @Override
    public String dateDiffDays(String start, String end) {
        return "DATE_DIFF(DATE(" + end + "), DATE(" + start + "), DAY)";
    }

    @Override
    public String percentileExpr(String column, double fraction) {
        return "APPROX_QUANTILES(" + column + ", 100)[OFFSET(" + Math.round(fraction * 100) + ")]";
    }

    @Override
    public String qualifyTable(String name) {
        if (name.contains(".") || name.startsWith("`") || projectId == null || dataset == null) {
            return name;
        }
        return "`" + projectId + "." + dataset + "." + name + "`";
    }
}
