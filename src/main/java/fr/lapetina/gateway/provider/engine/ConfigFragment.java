package fr.lapetina.gateway.provider.engine;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * The partial bundle contributed by one fragment file.
 */
public record ConfigFragment(List<JsonNode> routes, List<JsonNode> middlewares, Map<String, String> metadata) {

    public ConfigFragment {
        routes = List.copyOf(routes);
        middlewares = List.copyOf(middlewares);
        metadata = Map.copyOf(metadata);
    }

    public static ConfigFragment empty() {
        return new ConfigFragment(List.of(), List.of(), Map.of());
    }
}
