package org.carball.abacus.dialect;

import java.time.Instant;

public class DuckDbDialect implements SqlDialect {

    @Override
    public String name() {
        return "duckdb";
    }

    @Override
    public String formatTimestampLiteral(Instant timestamp) {
        return "TIMESTAMP '" + TIMESTAMP_FORMAT.format(timestamp) + "'";
    }

    @Override
    public String addInterval(String column, int days) {
        return column + " + INTERVAL " + days + " DAY";
    }

    @Override
    public String addHours(String column, int hours) {
        return column + " + INTERVAL " + hours + " HOUR";
    }

    @Override
    public String subtractMinutes(String column, int minutes) {
        return column + " - INTERVAL " + minutes + " MINUTE";
    }

    @Override
    public String matchesRegex(String column, String pattern) {
        return "regexp_matches(" + column + ", " + SqlLiterals.quote(pattern) + ")";
    }

    @Override
    public String dateDiffDays(String start, String end) {
        return "date_diff('day', " + start + ", " + end + ")";
    }

    @Override
    public String percentileExpr(String column, double fraction) {
        return "quantile_cont(" + column + ", " + SqlLiterals.number(fraction) + ")";
    }
}
