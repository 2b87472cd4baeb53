package org.carball.abacus.query;

import org.carball.abacus.dialect.SqlDialect;
import org.carball.abacus.dialect.SqlLiterals;
import org.carball.abacus.model.definition.ExperimentPhase;

import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes the placeholders allowed in raw experiment SQL overrides.
 */
public final class SqlOverrides {

    private static final Pattern DATE_START = Pattern.compile("\\{\\{\\s*dateStart\\s*}}");
    private static final Pattern DATE_END = Pattern.compile("\\{\\{\\s*dateEnd\\s*}}");
    private static final Pattern EXPERIMENT_KEY = Pattern.compile("\\{\\{\\s*experimentKey\\s*}}");

    private SqlOverrides() {
        // Utility class - prevent instantiation
    }

    /**
     * Replaces {@code {{dateStart}}}, {@code {{dateEnd}}} and {@code {{experimentKey}}}.
     * An open phase ends at {@code now}.
     */
    public static String apply(String template, ExperimentPhase phase, String trackingKey,
                               SqlDialect dialect, Instant now) {
        String sql = replace(DATE_START, template, dialect.formatTimestampLiteral(phase.dateStarted()));
        sql = replace(DATE_END, sql, dialect.formatTimestampLiteral(phase.end().orElse(now)));
        return replace(EXPERIMENT_KEY, sql, SqlLiterals.quote(trackingKey));
    }

    private static String replace(Pattern pattern, String sql, String value) {
        return pattern.matcher(sql).replaceAll(Matcher.quoteReplacement(value));
    }
}
