package fr.lapetina.gateway.provider.infrastructure.yaml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BigIntegerNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

import java.io.Reader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a single YAML document into a Jackson tree without going through
 * SnakeYAML's Java object construction.
 *
 * Scalars are resolved with {@link YamlScalarResolver}. Below a text path,
 * every non-null scalar becomes a text node holding its exact source text.
 * Paths name mapping keys joined by dots, with {@code []} for sequence
 * items, e.g. {@code configurations[].metadata}.
 *
 * Duplicate keys, non-scalar keys and recursive structures are rejected.
 * Merge keys ({@code <<}) are honoured; explicit keys win over merged ones.
 */
public final class YamlTreeReader {

    private final JsonNodeFactory nodeFactory = JsonNodeFactory.instance;
    private final LoaderOptions loaderOptions;
    private final Set<String> textPaths;

    public YamlTreeReader(Set<String> textPaths) {
        this.textPaths = Set.copyOf(textPaths);
        this.loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
    }

    /**
     * @return the document tree, or null for an empty document
     * @throws YAMLException if the document is malformed or has more than one document
     */
    public JsonNode read(Reader reader) {
        // Yaml instances are not thread-safe
        DumperOptions dumperOptions = new DumperOptions();
        Yaml yaml = new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions),
                dumperOptions, loaderOptions, new YamlScalarResolver());
        Node root = yaml.compose(reader);
        if (root == null) {
            return null;
        }
        return convert(root, "", false, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private JsonNode convert(Node node, String path, boolean asText, Set<Node> active) {
        boolean text = asText || textPaths.contains(path);
        switch (node.getNodeId()) {
            case scalar:
                return scalar((ScalarNode) node, text);
            case sequence:
                enter(node, active);
                ArrayNode array = nodeFactory.arrayNode();
                for (Node item : ((SequenceNode) node).getValue()) {
                    array.add(convert(item, path + "[]", text, active));
                }
                active.remove(node);
                return array;
            case mapping:
                enter(node, active);
                ObjectNode object = mapping((MappingNode) node, path, text, active);
                active.remove(node);
                return object;
            default:
                throw new YAMLException("Unexpected node " + node.getNodeId() + node.getStartMark());
        }
    }

    private ObjectNode mapping(MappingNode node, String path, boolean text, Set<Node> active) {
        ObjectNode object = nodeFactory.objectNode();
        List<Node> merged = new ArrayList<>();
        for (NodeTuple tuple : node.getValue()) {
            Node keyNode = tuple.getKeyNode();
            if (Tag.MERGE.equals(keyNode.getTag())) {
                collectMerged(tuple.getValueNode(), merged);
                continue;
            }
            if (!(keyNode instanceof ScalarNode)) {
                throw new YAMLException("Mapping keys must be scalars" + keyNode.getStartMark());
            }
            String key = ((ScalarNode) keyNode).getValue();
            if (object.has(key)) {
                throw new YAMLException("Duplicate key '" + key + "'" + keyNode.getStartMark());
            }
            String childPath = path.isEmpty() ? key : path + "." + key;
            object.set(key, convert(tuple.getValueNode(), childPath, text, active));
        }
        for (Node source : merged) {
            Iterator<Map.Entry<String, JsonNode>> fields = convert(source, path, text, active).fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                object.putIfAbsent(field.getKey(), field.getValue());
            }
        }
        return object;
    }

    private void collectMerged(Node value, List<Node> merged) {
        if (value instanceof MappingNode) {
            merged.add(value);
        } else if (value instanceof SequenceNode) {
            for (Node item : ((SequenceNode) value).getValue()) {
                if (!(item instanceof MappingNode)) {
                    throw new YAMLException("Merge sequence items must be mappings" + item.getStartMark());
                }
                merged.add(item);
            }
        } else {
            throw new YAMLException("Merge value must be a mapping or a sequence of mappings" + value.getStartMark());
        }
    }

    private void enter(Node node, Set<Node> active) {
        if (!active.add(node)) {
            throw new YAMLException("Recursive structure" + node.getStartMark());
        }
    }

    private JsonNode scalar(ScalarNode node, boolean text) {
        String value = node.getValue();
        Tag tag = node.getTag();
        if (Tag.NULL.equals(tag)) {
            return NullNode.getInstance();
        }
        if (text) {
            return TextNode.valueOf(value);
        }
        try {
            if (Tag.BOOL.equals(tag)) {
                return BooleanNode.valueOf(Boolean.parseBoolean(value));
            }
            if (Tag.INT.equals(tag)) {
                BigInteger number = new BigInteger(value);
                if (number.bitLength() < Integer.SIZE) {
                    return IntNode.valueOf(number.intValue());
                }
                if (number.bitLength() < Long.SIZE) {
                    return LongNode.valueOf(number.longValue());
                }
                return BigIntegerNode.valueOf(number);
            }
            if (Tag.FLOAT.equals(tag)) {
                // BigDecimal keeps the written scale, so 1.10 stays 1.10
                return DecimalNode.valueOf(new BigDecimal(value));
            }
        } catch (NumberFormatException e) {
            throw new YAMLException("Invalid " + tag.getValue() + " value '" + value + "'" + node.getStartMark(), e);
        }
        return TextNode.valueOf(value);
    }
}
