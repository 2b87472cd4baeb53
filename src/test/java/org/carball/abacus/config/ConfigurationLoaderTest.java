package org.carball.abacus.config;

import org.carball.abacus.model.definition.IdentifierType;
import org.carball.abacus.model.definition.MetricType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private ConfigurationLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader();
    }

    @Test
    void shouldLoadSettingsFromYaml() throws IOException {
        Path file = tempDir.resolve("settings.yml");
        Files.writeString(file, """
                default:
                  timestampColumn: ts
                experiments:
                  table: analytics.assignments
                  variationColumn: variant
                  variationFormat: key
                pageviews:
                  urlColumn: url
                identifies:
                  table: aliases
                """);

        SourceSettings settings = loader.loadSettings(file);

        assertThat(settings.table(LogicalTable.EXPERIMENTS)).isEqualTo("analytics.assignments");
        assertThat(settings.getVariationColumn()).isEqualTo("variant");
        assertThat(settings.getVariationFormat()).isEqualTo(VariationFormat.KEY);
        assertThat(settings.getUrlColumn()).isEqualTo("url");
        assertThat(settings.table(LogicalTable.IDENTIFIES)).isEqualTo("aliases");
        assertThat(settings.columnFor(LogicalTable.PAGEVIEWS, ColumnRole.TIMESTAMP)).isEqualTo("ts");
    }

    @Test
    void shouldUseDefaultsWithoutSettingsFile() throws IOException {
        assertThat(loader.loadSettings(null)).isEqualTo(SourceSettings.defaultSettings());
        assertThat(loader.parseSettings("  ")).isEqualTo(SourceSettings.defaultSettings());
    }

    @Test
    void shouldReportInvalidSettingsAsIOException() {
        assertThatThrownBy(() -> loader.parseSettings("experiments:\n  variationFormat: bogus\n"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("bogus");
    }

    @Test
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> loader.loadRequest(tempDir.resolve("missing.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Request file not found");
    }

    @Test
    void shouldLoadAnalysisRequest() throws IOException {
        Path file = tempDir.resolve("request.yml");
        Files.writeString(file, """
                experiment:
                  id: exp_1
                  trackingKey: checkout-button
                  userIdType: user
                  variations: [control, treatment]
                  phases:
                    - dateStarted: 2024-03-01T00:00:00Z
                      dateEnded: 2024-03-15T00:00:00Z
                    - dateStarted: 2024-03-20T00:00:00Z
                metrics:
                  - id: met_purchase
                    name: Purchased
                    type: binomial
                    table: purchases
                  - id: met_revenue
                    name: Revenue
                    type: revenue
                    table: purchases
                    column: amount
                    cap: 500
                dimension:
                  name: country
                  userIdType: anonymous
                  sql: SELECT anonymous_id as user_id, country as value FROM sessions
                """);

        AnalysisRequest request = loader.loadRequest(file);

        assertThat(request.getExperiment().getTrackingKey()).isEqualTo("checkout-button");
        assertThat(request.getExperiment().getUserIdType()).isEqualTo(IdentifierType.USER);
        assertThat(request.getExperiment().getConversionWindowHours()).isEqualTo(72);
        assertThat(request.getExperiment().getPhases()).hasSize(2);
        assertThat(request.getExperiment().latestPhase().dateStarted())
                .isEqualTo(Instant.parse("2024-03-20T00:00:00Z"));
        assertThat(request.getExperiment().latestPhase().end()).isEmpty();
        assertThat(request.getPhase()).isEqualTo(-1);
        assertThat(request.getMetrics()).extracting(m -> m.getType())
                .containsExactly(MetricType.BINOMIAL, MetricType.REVENUE);
        assertThat(request.getMetrics().get(1).getCap()).isEqualTo(500.0);
        assertThat(request.getMetrics().get(0).getUserIdType()).isEqualTo(IdentifierType.ANONYMOUS);
        assertThat(request.getDimension().name()).isEqualTo("country");
    }
}
