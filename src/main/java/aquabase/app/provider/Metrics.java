package aquabase.app.provider;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.prometheus.metrics.core.metrics.Counter;
import io.prometheus.metrics.core.metrics.Gauge;
import io.prometheus.metrics.model.snapshots.PrometheusNaming;
import io.sentry.Sentry;

/**
 * Process-wide Prometheus counters and gauges, all named under
 * {@value #NAMESPACE}. The label set of a metric is fixed by its first use, so
 * callers keep tag keys stable per metric name.
 */
public class Metrics {

    public static final String NAMESPACE = "aquabase";

    private static Logger log = null;
    private static Metrics singleton = null;

    private final String appName;
    private final String instanceName;

    private final Map<String, Counter> counters;
    private final Map<String, Gauge> gauges;

    private Metrics() {
        log = LoggerFactory.getLogger(Metrics.class);
        final var env = System.getenv();
        appName = StringUtils.defaultIfBlank(env.get("APP_NAME"), NAMESPACE);
        instanceName = StringUtils.defaultIfBlank(env.get("INSTANCE_NAME"), StringUtils.defaultIfBlank(env.get("HOSTNAME"), "local"));
        counters = new ConcurrentHashMap<>();
        gauges = new ConcurrentHashMap<>();
    }

    public static synchronized Metrics getInstance() {
        if (singleton == null) {
            singleton = new Metrics();
        }
        return singleton;
    }

    public static String metricName(String name) {
        return PrometheusNaming.sanitizeMetricName(NAMESPACE + "_" + name);
    }

    /**
     * Every series carries the service and the instance it runs on. The instance
     * label is not called "device" since device ids are labels of their own here.
     * Keys are sanitized; values stay as given so distinct device ids such as
     * {@code tank-1} and {@code tank_1} remain distinct series.
     */
    public Map<String, String> getNormalizedMetricTags(Map<String, String> tags) {
        final Map<String, String> metricTags = new LinkedHashMap<>();
        metricTags.put("application", appName);
        metricTags.put("instance", instanceName);
        if (tags != null) {
            tags.forEach((k, v) -> {
                metricTags.put(PrometheusNaming.sanitizeLabelName(k), StringUtils.defaultString(v));
            });
        }
        return metricTags;
    }

    public Map<String, String> postMetric(String name) {
        return postMetric(name, null, null);
    }

    public Map<String, String> postMetric(String name, Map<String, String> tags) {
        return postMetric(name, null, tags);
    }

    public Map<String, String> postMetric(String name, double value) {
        return postMetric(name, value, null);
    }

    /**
     * A null value counts one occurrence; any other value sets a gauge.
     */
    public Map<String, String> postMetric(String name, Double value, Map<String, String> tags) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("No metric name specified.");
        }
        final String metricName = metricName(name);
        final var metricTags = getNormalizedMetricTags(tags);
        final String[] metricTagKeys = metricTags.keySet().toArray(new String[metricTags.size()]);
        final String[] metricTagValues = metricTags.values().toArray(new String[metricTags.size()]);
        try {
            if (value == null) {
                Counter counter = counters.computeIfAbsent(metricName, c -> Counter.builder()
                    .name(metricName)
                    .labelNames(metricTagKeys)
                    .register());
                counter.labelValues(metricTagValues).inc();
            } else {
                Gauge gauge = gauges.computeIfAbsent(metricName + "_gauge", g -> Gauge.builder()
                    .name(metricName + "_gauge")
                    .labelNames(metricTagKeys)
                    .register());
                gauge.labelValues(metricTagValues).set(value);
            }
        } catch (RuntimeException e) {
            log.error("Cannot create metric object for metric {}: {}", metricName, e.getMessage(), e);
            Sentry.captureException(e);
        }
        return metricTags;
    }

    public void postError(Class<?> source, Throwable e) {
        postMetric("error", Map.of(
            "class", source.getSimpleName(),
            "exception", e.getClass().getSimpleName()));
    }
}
