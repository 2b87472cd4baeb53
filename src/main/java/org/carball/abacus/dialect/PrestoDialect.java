package org.carball.abacus.dialect;

import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * Presto, Trino and Athena.
 */
public class PrestoDialect implements SqlDialect {

    private final String catalog;

    public PrestoDialect(String catalog) {
        this.catalog = catalog;
    }

    @Override
    public String name() {
        return "presto";
    }

    @Override
    public String formatTimestampLiteral(Instant timestamp) {
        return "from_iso8601_timestamp('" + DateTimeFormatter.ISO_INSTANT.format(timestamp) + "')";
    }

    @Override
    public String addInterval(String column, int days) {
        return "date_add('day', " + days + ", " + column + ")";
    }

    @Override
    public String addHours(String column, int hours) {
        return "date_add('hour', " + hours + ", " + column + ")";
    }

    @Override
    public String subtractMinutes(String column, int minutes) {
        return "date_add('minute', -" + minutes + ", " + column + ")";
    }

    @Override
    public String matchesRegex(String column, String pattern) {
        return "regexp_like(" + column + ", " + SqlLiterals.quote(pattern) + ")";
    }

    // date_diff on timestamps counts whole days, on dates it counts boundaries
    @Override
    public String dateDiffDays(String start, String end) {
        return "date_diff('day', CAST(" + start + " AS date), CAST(" + end + " AS date))";
    }

    @Override
    public String percentileExpr(String column, double fraction) {
        return "approx_percentile(" + column + ", " + SqlLiterals.number(fraction) + ")";
    }

    @Override
    public String qualifyTable(String name) {
        if (catalog == null || catalog.isBlank() || name.contains(".")) {
            return name;
        }
        return catalog + "." + name;
    }
}
