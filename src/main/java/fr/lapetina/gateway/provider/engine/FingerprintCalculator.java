package fr.lapetina.gateway.provider.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.gateway.provider.domain.model.ConfigBundle;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 over a canonical JSON rendering of a bundle's version, routes,
 * middlewares and metadata. Object keys are sorted at every depth; the
 * fingerprint and load time never contribute.
 */
public final class FingerprintCalculator {

    private static final String ALGORITHM = "SHA-256";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public String fingerprint(ConfigBundle bundle) {
        ObjectNode canonical = objectMapper.createObjectNode();
        ArrayNode middlewares = canonical.putArray("middlewares");
        bundle.middlewares().forEach(node -> middlewares.add(canonicalize(node)));

        ObjectNode metadata = canonical.putObject("metadata");
        new TreeMap<>(bundle.metadata()).forEach(metadata::put);

        ArrayNode routes = canonical.putArray("routes");
        bundle.routes().forEach(node -> routes.add(canonicalize(node)));

        canonical.put("version", bundle.version());

        return digest(canonical);
    }

    private String digest(ObjectNode canonical) {
        try {
            MessageDigest sha = MessageDigest.getInstance(ALGORITHM);
            byte[] hash = sha.digest(objectMapper.writeValueAsBytes(canonical));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bundle for fingerprinting", e);
        }
    }

    private JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);

            ObjectNode sorted = objectMapper.createObjectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = objectMapper.createArrayNode();
            node.forEach(element -> copy.add(canonicalize(element)));
            return copy;
        }
        return node;
    }
}
