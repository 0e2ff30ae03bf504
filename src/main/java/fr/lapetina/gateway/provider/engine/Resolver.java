package fr.lapetina.gateway.provider.engine;

import fr.lapetina.gateway.provider.domain.exception.ConfigNotFoundException;
import fr.lapetina.gateway.provider.domain.exception.IndexInconsistencyException;
import fr.lapetina.gateway.provider.domain.matching.SourceMatcher;
import fr.lapetina.gateway.provider.domain.model.CacheEntry;
import fr.lapetina.gateway.provider.domain.model.ConfigurationSource;
import fr.lapetina.gateway.provider.domain.model.ProviderIndex;
import fr.lapetina.gateway.provider.domain.model.Resolution;
import fr.lapetina.gateway.provider.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Resolves request metadata to a source and its cached bundle.
 *
 * <p>Each call reads a single index generation, so the returned source and
 * bundle always belong together. Read-only; never blocks on reloads.
 */
public final class Resolver {

    private static final Logger log = LoggerFactory.getLogger(Resolver.class);

    private final CacheStore cacheStore;
    private final SourceMatcher matcher;
    private final MetricsRegistry metricsRegistry;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public Resolver(CacheStore cacheStore, SourceMatcher matcher, MetricsRegistry metricsRegistry) {
        this.cacheStore = cacheStore;
        this.matcher = matcher;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Picks the best-scoring source, falling back to the default source when
     * nothing scores above zero.
     *
     * @throws ConfigNotFoundException     if nothing matches and no default exists
     * @throws IndexInconsistencyException if the matched source has no cache entry
     */
    public Resolution resolve(Map<String, String> requestMetadata) {
        Map<String, String> metadata = requestMetadata != null ? requestMetadata : Map.of();
        ProviderIndex index = cacheStore.current();

        Optional<ConfigurationSource> matched = matcher.match(index.getSources(), metadata)
                .or(index::getDefaultSource);
        if (matched.isEmpty()) {
            misses.increment();
            metricsRegistry.incrementResolveCount("not_found");
            log.debug("No configuration matched metadata {}", metadata);
            throw new ConfigNotFoundException(metadata);
        }

        ConfigurationSource source = matched.get();
        Optional<CacheEntry> entry = index.getEntry(source.getId());
        if (entry.isEmpty()) {
            metricsRegistry.incrementResolveCount("internal_error");
            log.error("Index generation {} has source {} without a cache entry", index.getGeneration(), source.getId());
            throw new IndexInconsistencyException(source.getId(), index.getGeneration());
        }

        hits.increment();
        metricsRegistry.incrementResolveCount("hit");
        log.debug("Resolved metadata {} to config {}", metadata, source.getId());
        return new Resolution(source, entry.get().bundle(), index.getGeneration());
    }

    /**
     * Looks up a source of the published generation by id.
     */
    public Optional<ConfigurationSource> sourceFor(String id) {
        return cacheStore.current().findSource(id);
    }

    public long getHits() {
        return hits.sum();
    }

    public long getMisses() {
        return misses.sum();
    }
}
