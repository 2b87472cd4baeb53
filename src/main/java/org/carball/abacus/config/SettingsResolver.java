package org.carball.abacus.config;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;

/**
 * Merges user-supplied source settings onto the built-in defaults.
 *
 * <p>Precedence for every column: metric override (applied at lookup time by
 * {@link SourceSettings#columnFor(LogicalTable, ColumnRole, org.carball.abacus.model.definition.MetricDefinition)}),
 * then the section's own setting, then the {@code default} section, then the fallback literal.
 * Blank values count as unset.
 */
@Slf4j
public final class SettingsResolver {

    public static final String DEFAULT_USER_ID_COLUMN = "user_id";
    public static final String DEFAULT_ANONYMOUS_ID_COLUMN = "anonymous_id";
    public static final String DEFAULT_TIMESTAMP_COLUMN = "received_at";
    public static final String DEFAULT_EXPERIMENT_ID_COLUMN = "experiment_id";
    public static final String DEFAULT_VARIATION_COLUMN = "variation_id";
    public static final String DEFAULT_URL_COLUMN = "path";

    public static final String DEFAULT_EXPERIMENTS_TABLE = "experiment_viewed";
    public static final String DEFAULT_USERS_TABLE = "users";
    public static final String DEFAULT_PAGEVIEWS_TABLE = "pages";
    public static final String DEFAULT_IDENTIFIES_TABLE = "identifies";

    private SettingsResolver() {
        // Utility class - prevent instantiation
    }

    public static SourceSettings resolve(RawSourceSettings raw) {
        RawSourceSettings source = raw != null ? raw : new RawSourceSettings();
        RawTableSettings experiments = orEmpty(source.getExperiments());
        RawTableSettings pageviews = orEmpty(source.getPageviews());

        TableSettings defaults = TableSettings.builder()
                .userIdColumn(pick(source.getDefaults(), RawTableSettings::getUserIdColumn, DEFAULT_USER_ID_COLUMN))
                .anonymousIdColumn(pick(source.getDefaults(), RawTableSettings::getAnonymousIdColumn,
                        DEFAULT_ANONYMOUS_ID_COLUMN))
                .timestampColumn(pick(source.getDefaults(), RawTableSettings::getTimestampColumn,
                        DEFAULT_TIMESTAMP_COLUMN))
                .build();

        String variationFormat = firstNonBlank(experiments.getVariationFormat(), VariationFormat.INDEX.name());

        SourceSettings settings = SourceSettings.builder()
                .defaults(defaults)
                .experiments(section(experiments, defaults, DEFAULT_EXPERIMENTS_TABLE))
                .users(section(source.getUsers(), defaults, DEFAULT_USERS_TABLE))
                .pageviews(section(pageviews, defaults, DEFAULT_PAGEVIEWS_TABLE))
                .identifies(section(source.getIdentifies(), defaults, DEFAULT_IDENTIFIES_TABLE))
                .experimentIdColumn(firstNonBlank(experiments.getExperimentIdColumn(), DEFAULT_EXPERIMENT_ID_COLUMN))
                .variationColumn(firstNonBlank(experiments.getVariationColumn(), DEFAULT_VARIATION_COLUMN))
                .variationFormat(VariationFormat.fromName(variationFormat))
                .urlColumn(firstNonBlank(pageviews.getUrlColumn(), DEFAULT_URL_COLUMN))
                .build();

        log.debug("Resolved source settings: experiments={}, pageviews={}, identifies={}, variationFormat={}",
                settings.getExperiments().getTable(), settings.getPageviews().getTable(),
                settings.getIdentifies().getTable(), settings.getVariationFormat());
        return settings;
    }

    private static TableSettings section(RawTableSettings raw, TableSettings defaults, String fallbackTable) {
        return TableSettings.builder()
                .table(pick(raw, RawTableSettings::getTable, fallbackTable))
                .userIdColumn(pick(raw, RawTableSettings::getUserIdColumn, defaults.getUserIdColumn()))
                .anonymousIdColumn(pick(raw, RawTableSettings::getAnonymousIdColumn, defaults.getAnonymousIdColumn()))
                .timestampColumn(pick(raw, RawTableSettings::getTimestampColumn, defaults.getTimestampColumn()))
                .build();
    }

    private static String pick(RawTableSettings raw, Function<RawTableSettings, String> getter, String fallback) {
        return raw == null ? fallback : firstNonBlank(getter.apply(raw), fallback);
    }

    private static RawTableSettings orEmpty(RawTableSettings raw) {
        return raw != null ? raw : new RawTableSettings();
    }

    private static String firstNonBlank(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
