package fr.lapetina.gateway.provider.engine;

import fr.lapetina.gateway.provider.domain.model.ConfigurationSource;
import fr.lapetina.gateway.provider.domain.model.ProviderIndex;
import fr.lapetina.gateway.provider.domain.model.ProviderStats;
import fr.lapetina.gateway.provider.domain.model.Resolution;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * The operations the transport layer calls: resolve, reload, stats and
 * source lookup.
 */
public final class ConfigurationEngine {

    private final Resolver resolver;
    private final ReloadCoordinator reloadCoordinator;
    private final CacheStore cacheStore;
    private final Clock clock;
    private final Instant startTime;

    public ConfigurationEngine(Resolver resolver, ReloadCoordinator reloadCoordinator,
                               CacheStore cacheStore, Clock clock) {
        this.resolver = resolver;
        this.reloadCoordinator = reloadCoordinator;
        this.cacheStore = cacheStore;
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public Resolution resolve(Map<String, String> requestMetadata) {
        return resolver.resolve(requestMetadata);
    }

    public ProviderIndex reload() {
        return reloadCoordinator.reload();
    }

    public Optional<ConfigurationSource> sourceFor(String id) {
        return resolver.sourceFor(id);
    }

    public ProviderIndex currentIndex() {
        return cacheStore.current();
    }

    public ProviderStats stats() {
        ProviderIndex index = cacheStore.current();
        return new ProviderStats(
                index.size(),
                index.getLastReloadAt(),
                Duration.between(startTime, clock.instant()).toString(),
                index.getGeneration(),
                resolver.getHits(),
                resolver.getMisses(),
                reloadCoordinator.getFailures()
        );
    }
}
