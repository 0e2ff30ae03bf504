package fr.lapetina.gateway.provider.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import fr.lapetina.gateway.provider.domain.exception.ConfigLoadException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for parsers that first decode a document into a JSON tree.
 *
 * A fragment document is a mapping with optional {@code routes} and
 * {@code middlewares} sequences and an optional {@code metadata} mapping of
 * scalar values. Other top-level keys are ignored.
 */
abstract class TreeFragmentParser implements FragmentParser {

    static final String ROUTES = "routes";
    static final String MIDDLEWARES = "middlewares";
    static final String METADATA = "metadata";

    /**
     * Decodes raw content into a tree. Returns null for an empty document.
     */
    protected abstract JsonNode readTree(Path file, byte[] content);

    @Override
    public ConfigFragment parse(Path file, byte[] content) {
        JsonNode root = readTree(file, content);
        if (root == null || root.isNull() || root.isMissingNode()) {
            return ConfigFragment.empty();
        }
        if (!root.isObject()) {
            throw new ConfigLoadException(file, "Failed to parse " + getFormat() + ", expected a mapping at document root");
        }

        return new ConfigFragment(
                records(file, root, ROUTES),
                records(file, root, MIDDLEWARES),
                metadata(file, root.get(METADATA))
        );
    }

    private List<JsonNode> records(Path file, JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigLoadException(file, "Failed to parse " + getFormat() + ", '" + field + "' must be a sequence");
        }
        List<JsonNode> records = new ArrayList<>(node.size());
        for (JsonNode element : (ArrayNode) node) {
            records.add(element.deepCopy());
        }
        return records;
    }

    private Map<String, String> metadata(Path file, JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new ConfigLoadException(file, "Failed to parse " + getFormat() + ", 'metadata' must be a mapping");
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isContainerNode()) {
                throw new ConfigLoadException(file,
                        "Failed to parse " + getFormat() + ", metadata value for '" + field.getKey() + "' must be a scalar");
            }
            metadata.put(field.getKey(), value.isNull() ? "" : value.asText());
        }
        return metadata;
    }
}
