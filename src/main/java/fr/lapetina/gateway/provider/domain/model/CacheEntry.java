package fr.lapetina.gateway.provider.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A loaded bundle as held by the cache store.
 *
 * <p>{@code expiresAt} is informational: entries are replaced wholesale on
 * reload and never expire lazily.
 */
public record CacheEntry(ConfigBundle bundle, Instant expiresAt, String fingerprint) {

    public CacheEntry {
        Objects.requireNonNull(bundle, "Bundle is required");
        Objects.requireNonNull(expiresAt, "Expiry is required");
        Objects.requireNonNull(fingerprint, "Fingerprint is required");
    }
}
