package org.carball.abacus.query;

import org.carball.abacus.config.SourceSettings;
import org.carball.abacus.dialect.DuckDbDialect;
import org.carball.abacus.dialect.RedshiftDialect;
import org.carball.abacus.model.definition.DimensionDefinition;
import org.carball.abacus.model.definition.ExperimentDefinition;
import org.carball.abacus.model.definition.ExperimentPhase;
import org.carball.abacus.model.definition.IdentifierType;
import org.carball.abacus.model.definition.MetricCondition;
import org.carball.abacus.model.definition.MetricDefinition;
import org.carball.abacus.model.definition.MetricType;
import org.carball.abacus.model.definition.SegmentDefinition;
import org.carball.abacus.model.query.UsersQueryParams;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DerivedTablesTest {

    private final DerivedTables tables = new DerivedTables(SourceSettings.defaultSettings(), new RedshiftDialect());

    @Test
    void shouldBoundPageVisitsByWholeDays() {
        String sql = tables.pageUsers(UsersQueryParams.builder()
                .name("Blog")
                .from(Instant.parse("2024-03-01T15:00:00Z"))
                .to(Instant.parse("2024-03-31T08:00:00Z"))
                .urlRegex("^/blog")
                .build(), IdentifierType.ANONYMOUS);

        assertThat(sql)
                .contains("anonymous_id as user_id")
                .contains("MIN(received_at) + INTERVAL '3 days' as conversion_end")
                .contains("received_at >= '2024-03-01 00:00:00'")
                .contains("received_at <= '2024-03-31 00:00:00'")
                .contains("AND path ~ '^/blog'")
                .contains("GROUP BY\n  anonymous_id");
    }

    @Test
    void shouldSkipCatchAllUrlFilter() {
        String sql = tables.pageUsers(UsersQueryParams.builder()
                .name("All")
                .from(Instant.parse("2024-03-01T00:00:00Z"))
                .to(Instant.parse("2024-03-02T00:00:00Z"))
                .urlRegex(".*")
                .build(), IdentifierType.USER);

        assertThat(sql).doesNotContain("~").contains("user_id as user_id");
    }

    @Test
    void shouldUseMetricWindowBeforeFallback() {
        MetricDefinition metric = MetricDefinition.builder()
                .id("met_signup").name("Signed Up").type(MetricType.BINOMIAL).table("signups")
                .conditions(List.of(new MetricCondition("plan", "=", "pro")))
                .build();

        assertThat(tables.metric(metric, 72, IdentifierType.ANONYMOUS))
                .startsWith("-- Metric (Signed Up)")
                .contains("m.anonymous_id as user_id")
                .contains("1 as value")
                .contains("m.received_at + INTERVAL '72 hours' as conversion_end")
                .contains("m.received_at - INTERVAL '30 minutes' as session_start")
                .contains("signups m")
                .contains("WHERE m.plan = 'pro'");

        MetricDefinition ownWindow = metric.toBuilder().conversionWindowHours(6).build();
        assertThat(tables.metric(ownWindow, 72, IdentifierType.ANONYMOUS))
                .contains("m.received_at + INTERVAL '6 hours' as conversion_end");
    }

    @Test
    void shouldRejectInvalidMetric() {
        MetricDefinition metric = MetricDefinition.builder()
                .id("met_bad").type(MetricType.REVENUE).table("orders").column("amount").cap(-1)
                .build();

        assertThatThrownBy(() -> tables.metric(metric, 72, IdentifierType.USER))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cap");
    }

    @Test
    void shouldLeaveOpenPhaseUnbounded() {
        ExperimentDefinition experiment = ExperimentDefinition.builder()
                .trackingKey("hero").variations(List.of("a", "b")).conversionWindowHours(48)
                .build();
        Instant start = Instant.parse("2024-03-01T00:00:00Z");

        String open = tables.experiment(experiment, ExperimentPhase.running(start), IdentifierType.ANONYMOUS);
        String closed = tables.experiment(experiment,
                new ExperimentPhase(start, Instant.parse("2024-03-10T00:00:00Z")), IdentifierType.ANONYMOUS);

        assertThat(open)
                .contains("e.anonymous_id as user_id")
                .contains("e.variation_id as variation")
                .contains("e.received_at + INTERVAL '48 hours' as conversion_end")
                .contains("experiment_viewed e")
                .contains("e.experiment_id = 'hero'")
                .contains("e.received_at >= '2024-03-01 00:00:00'")
                .doesNotContain("<=");
        assertThat(closed).contains("AND e.received_at <= '2024-03-10 00:00:00'");
    }

    @Test
    void shouldPassThroughFragmentsInRequestedSpace() {
        SegmentDefinition segment = new SegmentDefinition(
                "paying", IdentifierType.USER, "SELECT user_id, date FROM paying_users");

        assertThat(tables.segment(segment, IdentifierType.USER))
                .isEqualTo("-- Segment (paying)\nSELECT user_id, date FROM paying_users\n");
    }

    @Test
    void shouldWrapFragmentsNeedingABridge() {
        DimensionDefinition dimension = new DimensionDefinition(
                "plan", IdentifierType.USER, "SELECT user_id, plan as value FROM accounts");

        String sql = new DerivedTables(SourceSettings.defaultSettings(), new DuckDbDialect())
                .dimension(dimension, IdentifierType.ANONYMOUS);

        assertThat(sql)
                .contains("i.anonymous_id as user_id")
                .contains("d.value")
                .contains("SELECT user_id, plan as value FROM accounts")
                .contains(") d")
                .contains("JOIN identifies i ON (")
                .contains("i.user_id = d.user_id");
    }
}
