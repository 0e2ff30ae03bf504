package fr.lapetina.gateway.provider.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Resolution counters by outcome
 * - Reload counters and duration
 * - Index size and generation gauges
 * - HTTP request counters by endpoint and status
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "config_provider";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> resolveCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> reloadCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final Counter authFailures;
    private final Timer reloadTimer;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.authFailures = Counter.builder(prefix + "_auth_failures_total")
                .description("Requests rejected by source authentication")
                .register(registry);

        this.reloadTimer = Timer.builder(prefix + "_reload_duration")
                .description("Time to build and publish a new index")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Registers gauges reading the published index through the given suppliers.
     */
    public void registerIndexGauges(Supplier<Number> sourceCount, Supplier<Number> generation) {
        Gauge.builder(prefix + "_sources_loaded", sourceCount, s -> s.get().doubleValue())
                .description("Number of configuration sources in the published index")
                .register(registry);

        Gauge.builder(prefix + "_index_generation", generation, s -> s.get().doubleValue())
                .description("Generation number of the published index")
                .register(registry);
    }

    /**
     * Increments the resolution counter for an outcome (hit, not_found, internal_error).
     */
    public void incrementResolveCount(String outcome) {
        resolveCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_resolve_total")
                        .description("Total number of metadata resolutions")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records a reload attempt and, when it succeeded, its duration.
     */
    public void recordReload(boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        reloadCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_reload_total")
                        .description("Total number of reload attempts")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
        if (success) {
            reloadTimer.record(duration);
        }
    }

    /**
     * Increments the HTTP request counter for an endpoint and status code.
     */
    public void incrementRequestCount(String endpoint, int status) {
        String key = endpoint + ":" + status;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_http_requests_total")
                        .description("Total number of HTTP requests")
                        .tag("endpoint", endpoint)
                        .tag("status", Integer.toString(status))
                        .register(registry)
        ).increment();
    }

    public void incrementAuthFailures() {
        authFailures.increment();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    @Override
    public void close() {
        registry.close();
    }
}
