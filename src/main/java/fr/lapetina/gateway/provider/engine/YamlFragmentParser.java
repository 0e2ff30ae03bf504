package fr.lapetina.gateway.provider.engine;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.gateway.provider.domain.exception.ConfigLoadException;
import fr.lapetina.gateway.provider.infrastructure.yaml.YamlTreeReader;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Set;

/**
 * YAML fragments, read with the YAML 1.2 core scalar types. Dates and
 * {@code yes/no} stay strings, decimals keep their written scale, and
 * metadata values keep their exact source text. An empty document yields an
 * empty fragment.
 */
public final class YamlFragmentParser extends TreeFragmentParser {

    private final YamlTreeReader treeReader = new YamlTreeReader(Set.of(METADATA));

    @Override
    public String getFormat() {
        return "YAML";
    }

    @Override
    public Set<String> getExtensions() {
        return Set.of(".yaml", ".yml");
    }

    @Override
    protected JsonNode readTree(Path file, byte[] content) {
        try {
            return treeReader.read(new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8));
        } catch (YAMLException e) {
            throw new ConfigLoadException(file, "Failed to parse YAML", e);
        }
    }
}
