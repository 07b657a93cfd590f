package io.healthcontroller.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/*
 * MetricsProvider is a utility class for creating and managing counters, gauges and timers
 * tagged with the controller's hostname.
 */
@Component
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String HOST_NAME_TAG = "hostname";

    private final MeterRegistry registry;
    private final String hostname;
    // a registry hands back the first gauge for a repeated id, so the backing value is reused too
    private final ConcurrentMap<String, AtomicDouble> gaugeValues = new ConcurrentHashMap<>();

    @Autowired
    public MetricsProvider(
        MeterRegistry registry,
        @Value("${controller.id}") String controllerId) {
        this.registry = registry;
        this.hostname = controllerId;
        log.info("MetricsProvider initialized for the controller: {}", hostname);
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     *
     * @param name the name of the counter
     * @param tags a map of tag keys to tag values
     * @return the Counter instance
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Create or retrieve a Gauge metric with the given name and tags.
     * Calls with the same name and tags return the same value holder.
     *
     * @param name the name of the gauge
     * @param tags a map of tag keys to tag values
     * @return the AtomicDouble instance representing the gauge value
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        String gaugeId = name + new TreeMap<>(tags);
        return gaugeValues.computeIfAbsent(gaugeId, id -> {
            AtomicDouble gaugeValue = new AtomicDouble(0);
            Gauge.builder(name, gaugeValue::get).tags(mapToTagArray(tags)).register(registry);
            return gaugeValue;
        });
    }

    /**
     * Unregister a gauge created by {@link #gauge(String, Map)}. No-op if it was never created.
     */
    public void removeGauge(String name, Map<String, String> tags) {
        AtomicDouble removed = gaugeValues.remove(name + new TreeMap<>(tags));
        if (removed == null) {
            return;
        }
        Gauge gauge = registry.find(name).tags(mapToTagArray(tags)).gauge();
        if (gauge != null) {
            registry.remove(gauge);
        }
    }

    /**
     * Create or retrieve a Timer metric with the given name and tags.
     *
     * @param name the name of the timer
     * @param tags a map of tag keys to tag values
     * @return the Timer instance
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
            .publishPercentileHistogram()
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    /**
     * Convert a map of tags to an array of alternating keys and values, including hostname.
     */
    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = HOST_NAME_TAG;
        tagArray[index] = hostname;
        return tagArray;
    }
}
