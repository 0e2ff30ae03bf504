package fr.lapetina.gateway.provider.domain.matching;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Derives the canonical cache key of a metadata set.
 *
 * <p>Pairs are rendered as {@code key=value}, ordered by lower-cased key,
 * joined with {@code &} and lower-cased, so the key never depends on map
 * iteration order. An empty set maps to {@value #DEFAULT_KEY}.
 */
public final class CanonicalKeys {

    public static final String DEFAULT_KEY = "default";
    private static final String PAIR_SEPARATOR = "&";

    private CanonicalKeys() {
    }

    public static String deriveKey(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return DEFAULT_KEY;
        }

        Map<String, String> sorted = new TreeMap<>();
        metadata.forEach((k, v) -> sorted.put(k.toLowerCase(Locale.ROOT), v == null ? "" : v));

        return sorted.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(PAIR_SEPARATOR))
                .toLowerCase(Locale.ROOT);
    }
}
