package org.carball.abacus.dialect;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Primitive SQL fragments for one warehouse flavor.
 *
 * <p>Every method is a pure string builder. Implementations differ in syntax only: the same
 * logical inputs must evaluate to the same value on every engine. The defaults use
 * Redshift/ANSI syntax.
 */
public interface SqlDialect {

    DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    String name();

    default String formatTimestampLiteral(Instant timestamp) {
        return "'" + TIMESTAMP_FORMAT.format(timestamp) + "'";
    }

    default String addInterval(String column, int days) {
        return column + " + INTERVAL '" + days + " days'";
    }

    default String addHours(String column, int hours) {
        return column + " + INTERVAL '" + hours + " hours'";
    }

    default String subtractMinutes(String column, int minutes) {
        return column + " - INTERVAL '" + minutes + " minutes'";
    }

    default String subtractHalfHour(String column) {
        return subtractMinutes(column, 30);
    }

    /**
     * Boolean predicate, true when the pattern matches anywhere in the value.
     */
    default String matchesRegex(String column, String pattern) {
        return column + " ~ " + SqlLiterals.quote(pattern);
    }

    default String truncateToDay(String column) {
        return "date_trunc('day', " + column + ")";
    }

    /**
     * Number of day boundaries crossed going from start to end.
     */
    default String dateDiffDays(String start, String end) {
        return "datediff(day, " + start + ", " + end + ")";
    }

    /**
     * Sample standard deviation aggregate.
     */
    default String stddev(String column) {
        return "STDDEV(" + column + ")";
    }

    /**
     * Aggregate returning the continuous percentile of the column, fraction in [0, 1].
     */
    String percentileExpr(String column, double fraction);

    default String qualifyTable(String name) {
        return name;
    }
}
