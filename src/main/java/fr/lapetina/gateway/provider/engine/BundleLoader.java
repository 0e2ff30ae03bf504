package fr.lapetina.gateway.provider.engine;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.gateway.provider.domain.exception.ConfigLoadException;
import fr.lapetina.gateway.provider.domain.model.ConfigBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Loads every fragment under a directory and merges them into one bundle.
 *
 * <p>Files are visited recursively in lexicographic path order. Files whose
 * extension no parser claims are skipped. Routes and middlewares are
 * concatenated without de-duplication; metadata keys are last-write-wins.
 * Any unreadable or malformed fragment fails the whole directory.
 *
 * <p>Works on any {@link java.nio.file.FileSystem} the given path belongs to.
 */
public final class BundleLoader {

    private static final Logger log = LoggerFactory.getLogger(BundleLoader.class);

    private final Map<String, FragmentParser> parsersByExtension = new HashMap<>();

    public BundleLoader(List<FragmentParser> parsers) {
        for (FragmentParser parser : parsers) {
            for (String extension : parser.getExtensions()) {
                parsersByExtension.put(extension.toLowerCase(Locale.ROOT), parser);
            }
        }
    }

    /**
     * Creates a loader for YAML ({@code .yaml}, {@code .yml}) and JSON ({@code .json}) fragments.
     */
    public static BundleLoader withDefaultParsers() {
        return new BundleLoader(List.of(new YamlFragmentParser(), new JsonFragmentParser()));
    }

    /**
     * Loads and merges all fragments under {@code directory}.
     *
     * @return an unfingerprinted bundle
     * @throws ConfigLoadException if the directory cannot be walked or any fragment fails
     */
    public ConfigBundle load(Path directory) {
        List<Path> files = listFragments(directory);

        List<JsonNode> routes = new ArrayList<>();
        List<JsonNode> middlewares = new ArrayList<>();
        Map<String, String> metadata = new LinkedHashMap<>();

        for (Path file : files) {
            FragmentParser parser = parserFor(file).orElseThrow();
            byte[] content;
            try {
                content = Files.readAllBytes(file);
            } catch (IOException e) {
                throw new ConfigLoadException(file, "Failed to read", e);
            }

            ConfigFragment fragment = parser.parse(file, content);
            routes.addAll(fragment.routes());
            middlewares.addAll(fragment.middlewares());
            metadata.putAll(fragment.metadata());

            log.debug("Loaded {} fragment {}: routes={}, middlewares={}",
                    parser.getFormat(), file, fragment.routes().size(), fragment.middlewares().size());
        }

        log.debug("Loaded {} fragments from {}", files.size(), directory);
        return new ConfigBundle(ConfigBundle.DEFAULT_VERSION, routes, middlewares, metadata, "", null);
    }

    private List<Path> listFragments(Path directory) {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(path -> parserFor(path).isPresent())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ConfigLoadException(directory, "Failed to walk directory", e);
        } catch (UncheckedIOException e) {
            throw new ConfigLoadException(directory, "Failed to walk directory", e.getCause());
        }
    }

    Optional<FragmentParser> parserFor(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(parsersByExtension.get(name.substring(dot).toLowerCase(Locale.ROOT)));
    }
}
