package fr.lapetina.gateway.provider.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One complete, immutable generation of sources and their loaded bundles.
 *
 * <p>A generation is never patched: a reload builds a new instance and
 * publishes it in a single step, so a reader holding a reference always sees
 * sources and cache entries from the same load.
 */
public final class ProviderIndex {

    private final long generation;
    private final List<ConfigurationSource> sources;
    private final Map<String, ConfigurationSource> sourcesById;
    private final Map<String, CacheEntry> cache;
    private final String defaultId;
    private final Instant lastReloadAt;

    public ProviderIndex(
            long generation,
            List<ConfigurationSource> sources,
            Map<String, CacheEntry> cache,
            String defaultId,
            Instant lastReloadAt
    ) {
        this.generation = generation;
        this.sources = List.copyOf(sources);
        Map<String, ConfigurationSource> byId = new LinkedHashMap<>();
        for (ConfigurationSource source : this.sources) {
            byId.put(source.getId(), source);
        }
        this.sourcesById = Collections.unmodifiableMap(byId);
        this.cache = Collections.unmodifiableMap(new LinkedHashMap<>(cache));
        this.defaultId = defaultId;
        this.lastReloadAt = lastReloadAt;
    }

    /**
     * The index in place before the first successful load.
     */
    public static ProviderIndex empty() {
        return new ProviderIndex(0, List.of(), Map.of(), null, null);
    }

    public long getGeneration() {
        return generation;
    }

    /**
     * Sources in declaration order.
     */
    public List<ConfigurationSource> getSources() {
        return sources;
    }

    public Optional<ConfigurationSource> findSource(String id) {
        return Optional.ofNullable(sourcesById.get(id));
    }

    public Optional<CacheEntry> getEntry(String id) {
        return Optional.ofNullable(cache.get(id));
    }

    public Map<String, CacheEntry> getCache() {
        return cache;
    }

    public Optional<String> getDefaultId() {
        return Optional.ofNullable(defaultId);
    }

    public Optional<ConfigurationSource> getDefaultSource() {
        return getDefaultId().flatMap(this::findSource);
    }

    /**
     * Time of the publish that produced this generation, null for the empty index.
     */
    public Instant getLastReloadAt() {
        return lastReloadAt;
    }

    public int size() {
        return sources.size();
    }

    @Override
    public String toString() {
        return "ProviderIndex{generation=" + generation +
                ", sources=" + sourcesById.keySet() +
                ", default=" + defaultId + '}';
    }
}
