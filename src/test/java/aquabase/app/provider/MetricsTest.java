package aquabase.app.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

import io.prometheus.metrics.model.registry.PrometheusRegistry;
import io.prometheus.metrics.model.snapshots.CounterSnapshot;
import io.prometheus.metrics.model.snapshots.GaugeSnapshot;
import io.prometheus.metrics.model.snapshots.MetricSnapshot;

class MetricsTest {

    private static MetricSnapshot scraped(String name) {
        for (MetricSnapshot snapshot : PrometheusRegistry.defaultRegistry.scrape()) {
            if (snapshot.getMetadata().getName().equals(name)) {
                return snapshot;
            }
        }
        throw new AssertionError("No metric " + name);
    }

    @Test
    void testSingleton() {
        assertSame(Metrics.getInstance(), Metrics.getInstance());
    }

    @Test
    void testNamesAreNamespaced() {
        assertEquals("aquabase_tank_level", Metrics.metricName("tank_level"));
        assertEquals("aquabase_api_error", Metrics.metricName("api-error"));
    }

    @Test
    void testLabelKeysSanitizedValuesKept() {
        final Map<String, String> tags = Metrics.getInstance().getNormalizedMetricTags(Map.of("device-id", "tank-1"));

        assertTrue(tags.containsKey("application"));
        assertTrue(tags.containsKey("instance"));
        assertEquals("tank-1", tags.get("device_id"));
    }

    @Test
    void testCounterCountsPerLabelValue() {
        final Metrics metrics = Metrics.getInstance();
        metrics.postMetric("counter_under_test", Map.of("device_id", "tank-1"));
        metrics.postMetric("counter_under_test", Map.of("device_id", "tank-1"));
        metrics.postMetric("counter_under_test", Map.of("device_id", "tank_1"));

        final CounterSnapshot counter = (CounterSnapshot) scraped("aquabase_counter_under_test");
        assertEquals(2, counter.getDataPoints().size());
        final double tank1 = counter.getDataPoints().stream()
            .filter(p -> "tank-1".equals(p.getLabels().get("device_id")))
            .findFirst().get().getValue();
        assertEquals(2d, tank1);
    }

    @Test
    void testValueSetsGauge() {
        Metrics.getInstance().postMetric("level_under_test", 42.5, Map.of("device_id", "T1"));

        final GaugeSnapshot gauge = (GaugeSnapshot) scraped("aquabase_level_under_test_gauge");
        assertEquals(42.5, gauge.getDataPoints().get(0).getValue());
    }

    @Test
    void testBlankNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> Metrics.getInstance().postMetric(" "));
    }
}
