package org.carball.abacus.dialect;

import java.time.Instant;

public class ClickHouseDialect implements SqlDialect {

    private final String database;

    public ClickHouseDialect(String database) {
        this.database = database;
    }

    @Override
    public String name() {
        return "clickhouse";
    }

    @Override
    public String formatTimestampLiteral(Instant timestamp) {
        return "toDateTime('" + TIMESTAMP_FORMAT.format(timestamp) + "')";
    }

    @Override
    public String addInterval(String column, int days) {
        return "dateAdd(day, " + days + ", " + column + ")";
    }

    @Override
    public String addHours(String column, int hours) {
        return "dateAdd(hour, " + hours + ", " + column + ")";
    }

    @Override
    public String subtractMinutes(String column, int minutes) {
        return "dateSub(minute, " + minutes + ", " + column + ")";
    }

    @Override
    public String matchesRegex(String column, String pattern) {
        return "match(" + column + ", " + SqlLiterals.quoteWithBackslashEscapes(pattern) + ")";
    }

    @Override
    public String truncateToDay(String column) {
        return "toStartOfDay(" + column + ")";
    }

    @Override
    public String dateDiffDays(String start, String end) {
        return "dateDiff('day', " + start + ", " + end + ")";
    }

    @Override
    public String stddev(String column) {
        return "stddevSamp(" + column + ")";
    }

    // quantile() is sampled; the inclusive exact variant interpolates like PERCENTILE_CONT
    @Override
    public String percentileExpr(String column, double fraction) {
        return "quantileExactInclusive(" + SqlLiterals.number(fraction) + ")(" + column + ")";
    }

    @Override
    public String qualifyTable(String name) {
        if (database == null || database.isBlank() || name.contains(".")) {
            return name;
        }
        return database + "." + name;
    }
}
