package fr.lapetina.gateway.provider.engine;

import fr.lapetina.gateway.provider.domain.exception.ProviderException;
import fr.lapetina.gateway.provider.domain.model.ConfigurationSource;
import fr.lapetina.gateway.provider.domain.model.ProviderIndex;
import fr.lapetina.gateway.provider.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes reloads and publishes each fully built index in one step.
 *
 * <p>The new generation is built while readers keep using the published
 * one. A failed build publishes nothing and leaves both the index and the
 * source list untouched. Concurrent callers wait for the running reload.
 */
public final class ReloadCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ReloadCoordinator.class);

    private final IndexBuilder indexBuilder;
    private final CacheStore cacheStore;
    private final MetricsRegistry metricsRegistry;
    private final ReentrantLock reloadLock = new ReentrantLock();
    private final LongAdder failures = new LongAdder();

    private volatile List<ConfigurationSource> sources;

    public ReloadCoordinator(List<ConfigurationSource> sources, IndexBuilder indexBuilder,
                             CacheStore cacheStore, MetricsRegistry metricsRegistry) {
        this.sources = List.copyOf(sources);
        this.indexBuilder = indexBuilder;
        this.cacheStore = cacheStore;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Rebuilds the index from the current source list.
     *
     * @return the published generation
     * @throws ProviderException if validation or loading fails; the previous index stays published
     */
    public ProviderIndex reload() {
        return reload(null);
    }

    /**
     * Rebuilds the index from a new source list, which replaces the current
     * one only if the reload succeeds.
     *
     * @param newSources sources to load, or null to reuse the current list
     * @return the published generation
     * @throws ProviderException if validation or loading fails; the previous index stays published
     */
    public ProviderIndex reload(List<ConfigurationSource> newSources) {
        reloadLock.lock();
        try {
            List<ConfigurationSource> target = newSources != null ? List.copyOf(newSources) : sources;
            long previousGeneration = cacheStore.current().getGeneration();
            long start = System.nanoTime();

            ProviderIndex next;
            try {
                next = indexBuilder.build(target, previousGeneration + 1);
            } catch (ProviderException e) {
                failures.increment();
                metricsRegistry.recordReload(false, Duration.ofNanos(System.nanoTime() - start));
                log.warn("Reload failed, keeping index generation {}: {}", previousGeneration, e.getMessage());
                throw e;
            }

            cacheStore.publish(next);
            sources = target;

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metricsRegistry.recordReload(true, elapsed);
            log.info("Configuration reloaded: generation={}, configs={}, default={}, took={}ms",
                    next.getGeneration(), next.size(), next.getDefaultId().orElse("none"), elapsed.toMillis());
            return next;
        } finally {
            reloadLock.unlock();
        }
    }

    public List<ConfigurationSource> getSources() {
        return sources;
    }

    public boolean isReloading() {
        return reloadLock.isLocked();
    }

    public long getFailures() {
        return failures.sum();
    }
}
