package org.carball.abacus.config;

import org.carball.abacus.model.definition.MetricDefinition;
import org.carball.abacus.model.definition.MetricType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SettingsResolverTest {

    @Test
    void shouldUseFallbacksWhenNothingIsConfigured() {
        SourceSettings settings = SettingsResolver.resolve(null);

        assertThat(settings.table(LogicalTable.EXPERIMENTS)).isEqualTo("experiment_viewed");
        assertThat(settings.table(LogicalTable.PAGEVIEWS)).isEqualTo("pages");
        assertThat(settings.table(LogicalTable.USERS)).isEqualTo("users");
        assertThat(settings.table(LogicalTable.IDENTIFIES)).isEqualTo("identifies");
        assertThat(settings.columnFor(LogicalTable.EXPERIMENTS, ColumnRole.USER_ID)).isEqualTo("user_id");
        assertThat(settings.columnFor(LogicalTable.PAGEVIEWS, ColumnRole.ANONYMOUS_ID)).isEqualTo("anonymous_id");
        assertThat(settings.columnFor(LogicalTable.DEFAULT, ColumnRole.TIMESTAMP)).isEqualTo("received_at");
        assertThat(settings.getExperimentIdColumn()).isEqualTo("experiment_id");
        assertThat(settings.getVariationColumn()).isEqualTo("variation_id");
        assertThat(settings.getUrlColumn()).isEqualTo("path");
        assertThat(settings.getVariationFormat()).isEqualTo(VariationFormat.INDEX);
    }

    @Test
    void shouldLetSectionOverrideDefaultSection() {
        RawSourceSettings raw = RawSourceSettings.builder()
                .defaults(RawTableSettings.builder().timestampColumn("ts").userIdColumn("uid").build())
                .experiments(RawTableSettings.builder().timestampColumn("assigned_at").build())
                .build();

        SourceSettings settings = SettingsResolver.resolve(raw);

        assertThat(settings.columnFor(LogicalTable.EXPERIMENTS, ColumnRole.TIMESTAMP)).isEqualTo("assigned_at");
        assertThat(settings.columnFor(LogicalTable.EXPERIMENTS, ColumnRole.USER_ID)).isEqualTo("uid");
        assertThat(settings.columnFor(LogicalTable.PAGEVIEWS, ColumnRole.TIMESTAMP)).isEqualTo("ts");
        assertThat(settings.columnFor(LogicalTable.IDENTIFIES, ColumnRole.ANONYMOUS_ID)).isEqualTo("anonymous_id");
    }

    @Test
    void shouldTreatBlankValuesAsUnset() {
        RawSourceSettings raw = RawSourceSettings.builder()
                .pageviews(RawTableSettings.builder().table(" ").urlColumn("").build())
                .build();

        SourceSettings settings = SettingsResolver.resolve(raw);

        assertThat(settings.table(LogicalTable.PAGEVIEWS)).isEqualTo("pages");
        assertThat(settings.getUrlColumn()).isEqualTo("path");
    }

    @Test
    void shouldPreferMetricOverrideOverSection() {
        SourceSettings settings = SettingsResolver.resolve(RawSourceSettings.builder()
                .defaults(RawTableSettings.builder().timestampColumn("ts").build())
                .build());
        MetricDefinition metric = MetricDefinition.builder()
                .id("met_1").type(MetricType.BINOMIAL).table("purchases")
                .timestampColumn("purchased_at")
                .build();

        assertThat(settings.columnFor(LogicalTable.DEFAULT, ColumnRole.TIMESTAMP, metric)).isEqualTo("purchased_at");
        assertThat(settings.columnFor(LogicalTable.DEFAULT, ColumnRole.USER_ID, metric)).isEqualTo("user_id");
        assertThat(settings.columnFor(LogicalTable.DEFAULT, ColumnRole.TIMESTAMP, null)).isEqualTo("ts");
    }

    @Test
    void shouldParseVariationFormatCaseInsensitively() {
        SourceSettings settings = SettingsResolver.resolve(RawSourceSettings.builder()
                .experiments(RawTableSettings.builder().variationFormat("Key").build())
                .build());

        assertThat(settings.getVariationFormat()).isEqualTo(VariationFormat.KEY);
    }

    @Test
    void shouldRejectUnknownVariationFormat() {
        RawSourceSettings raw = RawSourceSettings.builder()
                .experiments(RawTableSettings.builder().variationFormat("ordinal").build())
                .build();

        assertThatThrownBy(() -> SettingsResolver.resolve(raw))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ordinal");
    }

    @Test
    void shouldRejectTableLookupOfDefaultSection() {
        SourceSettings settings = SourceSettings.defaultSettings();

        assertThatThrownBy(() -> settings.table(LogicalTable.DEFAULT))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
