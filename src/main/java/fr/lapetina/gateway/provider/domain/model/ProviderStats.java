package fr.lapetina.gateway.provider.domain.model;

import java.time.Instant;

/**
 * Point-in-time provider statistics.
 */
public record ProviderStats(
        int configsLoaded,
        Instant lastReload,
        String uptime,
        long generation,
        long cacheHits,
        long cacheMisses,
        long reloadFailures
) {
}
