package fr.lapetina.gateway.provider.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import fr.lapetina.gateway.provider.domain.exception.ConfigLoadException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Strict JSON fragments. An empty file is a parse error.
 */
public final class JsonFragmentParser extends TreeFragmentParser {

    private final ObjectMapper objectMapper;

    public JsonFragmentParser() {
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY)
                // decimals keep their written scale, as in YAML fragments
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
    }

    @Override
    public String getFormat() {
        return "JSON";
    }

    @Override
    public Set<String> getExtensions() {
        return Set.of(".json");
    }

    @Override
    protected JsonNode readTree(Path file, byte[] content) {
        try {
            JsonNode root = objectMapper.readTree(content);
            if (root == null || root.isMissingNode()) {
                throw new ConfigLoadException(file, "Failed to parse JSON, empty document");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ConfigLoadException(file, "Failed to parse JSON", e);
        } catch (IOException e) {
            throw new ConfigLoadException(file, "Failed to read JSON", e);
        }
    }
}
