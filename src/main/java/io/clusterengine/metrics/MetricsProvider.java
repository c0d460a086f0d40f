package io.clusterengine.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/*
 * MetricsProvider creates counters, gauges and timers tagged with the id of the
 * engine that reports them.
 */
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String ENGINE_ID_TAG = "engine";

    private final MeterRegistry registry;
    private final String engineId;

    public MetricsProvider(MeterRegistry registry, String engineId) {
        this.registry = registry;
        this.engineId = engineId;
        log.info("MetricsProvider initialized for engine: {}", engineId);
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
     * Create a Gauge metric with the given name and tags, starting at zero.
     *
     * @return the AtomicDouble backing the gauge value
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        AtomicDouble gaugeValue = new AtomicDouble(0);
        Gauge.builder(name, gaugeValue::get).tags(mapToTagArray(tags)).register(registry);
        return gaugeValue;
    }

    /**
     * Create or retrieve a Timer metric with the given name and tags.
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = ENGINE_ID_TAG;
        tagArray[index] = engineId;
        return tagArray;
    }
}
