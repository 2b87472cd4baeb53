package org.carball.abacus.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.abacus.model.result.DateMetricValue;
import org.carball.abacus.model.result.DateUsers;
import org.carball.abacus.model.result.MetricValueResult;
import org.carball.abacus.model.result.PastExperiment;
import org.carball.abacus.model.result.PastExperimentResult;
import org.carball.abacus.model.result.UsersResult;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns warehouse rows, where every value arrives as text, into typed results. Parsing is
 * lenient: unparsable numbers become 0 and nothing here throws on bad data.
 */
@Slf4j
public final class ResultParser {

    private static final Pattern PERCENTILE_COLUMN = Pattern.compile("^p(\\d+)$");

    private ResultParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Rows with a date populate the daily series, the others the overall count.
     */
    public static UsersResult parseUsers(List<Map<String, String>> rows) {
        UsersResult result = new UsersResult();
        for (Map<String, String> row : rows) {
            long users = parseLong(row.get("users"));
            String date = date(row);
            if (date != null) {
                result.getDates().add(new DateUsers(date, users));
            } else {
                result.setUsers(users);
            }
        }
        return result;
    }

    public static MetricValueResult parseMetricValue(List<Map<String, String>> rows) {
        MetricValueResult result = new MetricValueResult();
        for (Map<String, String> row : rows) {
            long count = parseLong(row.get("count"));
            double mean = parseDouble(row.get("mean"));
            double stddev = parseDouble(row.get("stddev"));

            String date = date(row);
            if (date != null) {
                result.getDates().add(new DateMetricValue(date, count, mean, stddev));
                continue;
            }
            result.setCount(count);
            result.setMean(mean);
            result.setStddev(stddev);
            row.forEach((column, value) -> {
                Matcher matcher = PERCENTILE_COLUMN.matcher(column);
                if (matcher.matches()) {
                    result.getPercentiles().put(Integer.parseInt(matcher.group(1)), parseDouble(value));
                }
            });
        }
        return result;
    }

    public static PastExperimentResult parsePastExperiments(List<Map<String, String>> rows) {
        List<PastExperiment> experiments = rows.stream()
                .map(row -> new PastExperiment(
                        row.get("experiment_id"),
                        row.get("variation_id"),
                        parseDate(row.get("start_date")),
                        parseDate(row.get("end_date")),
                        parseLong(row.get("users"))))
                .toList();
        return new PastExperimentResult(experiments);
    }

    /**
     * Whole number, accepting decimal text by truncation. 0 when absent or unparsable.
     */
    public static long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        String text = value.trim();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            double parsed = parseDouble(text);
            return (long) parsed;
        }
    }

    /**
     * Floating point number. 0 when absent, unparsable or not a number.
     */
    public static double parseDouble(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isNaN(parsed) ? 0 : parsed;
        } catch (NumberFormatException e) {
            log.debug("Treating non-numeric value '{}' as 0", value);
            return 0;
        }
    }

    /**
     * Calendar date from the leading {@code yyyy-MM-dd} of a date or timestamp text.
     */
    public static LocalDate parseDate(String value) {
        if (value == null || value.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException e) {
            log.debug("Unparsable date '{}'", value);
            return null;
        }
    }

    private static String date(Map<String, String> row) {
        String date = row.get("date");
        return date == null || date.isBlank() ? null : date;
    }
}
