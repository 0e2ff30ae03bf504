package fr.lapetina.gateway.provider.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The merged, servable configuration of one source.
 * Immutable and thread-safe once placed in an index.
 *
 * <p>Route and middleware records are opaque JSON trees passed through
 * unparsed; callers must treat them as read-only.
 */
@JsonPropertyOrder({"version", "routes", "middlewares", "metadata", "checksum", "timestamp"})
public record ConfigBundle(
        @JsonProperty("version") String version,
        @JsonProperty("routes") List<JsonNode> routes,
        @JsonProperty("middlewares") List<JsonNode> middlewares,
        @JsonProperty("metadata") Map<String, String> metadata,
        @JsonProperty("checksum") String fingerprint,
        @JsonProperty("timestamp") Instant loadedAt
) {
    public static final String DEFAULT_VERSION = "1.0";

    public ConfigBundle {
        version = version != null ? version : DEFAULT_VERSION;
        routes = routes != null ? List.copyOf(routes) : List.of();
        middlewares = middlewares != null ? List.copyOf(middlewares) : List.of();
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
        fingerprint = fingerprint != null ? fingerprint : "";
    }

    /**
     * Returns a copy whose metadata is this bundle's metadata overlaid with the given entries.
     */
    public ConfigBundle withMetadata(Map<String, String> overlay) {
        Map<String, String> merged = new LinkedHashMap<>(metadata);
        merged.putAll(overlay);
        return new ConfigBundle(version, routes, middlewares, merged, fingerprint, loadedAt);
    }

    public ConfigBundle withFingerprint(String fingerprint) {
        return new ConfigBundle(version, routes, middlewares, metadata, fingerprint, loadedAt);
    }

    public ConfigBundle withLoadedAt(Instant loadedAt) {
        return new ConfigBundle(version, routes, middlewares, metadata, fingerprint, loadedAt);
    }
}
