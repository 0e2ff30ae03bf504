package fr.lapetina.gateway.provider.infrastructure.yaml;

import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

import java.util.regex.Pattern;

/**
 * Implicit scalar resolution limited to the YAML 1.2 core schema.
 *
 * Timestamps are not recognized, {@code yes/no/on/off} stay strings, and
 * integers are decimal only. Special floats ({@code .inf}, {@code .nan})
 * stay strings.
 */
public class YamlScalarResolver extends Resolver {

    static final Pattern CORE_BOOL = Pattern.compile("^(?:true|True|TRUE|false|False|FALSE)$");
    static final Pattern CORE_INT = Pattern.compile("^[-+]?[0-9]+$");
    static final Pattern CORE_FLOAT = Pattern.compile("^[-+]?(?:\\.[0-9]+|[0-9]+(?:\\.[0-9]*)?)(?:[eE][-+]?[0-9]+)?$");

    @Override
    protected void addImplicitResolvers() {
        // order matters: the first matching resolver for a leading character wins
        addImplicitResolver(Tag.BOOL, CORE_BOOL, "tTfF");
        addImplicitResolver(Tag.INT, CORE_INT, "-+0123456789");
        addImplicitResolver(Tag.FLOAT, CORE_FLOAT, "-+0123456789.");
        addImplicitResolver(Tag.MERGE, MERGE, "<");
        addImplicitResolver(Tag.NULL, NULL, "~nN\0");
        addImplicitResolver(Tag.NULL, EMPTY, null);
        addImplicitResolver(Tag.YAML, YAML, "!&*");
    }
}
