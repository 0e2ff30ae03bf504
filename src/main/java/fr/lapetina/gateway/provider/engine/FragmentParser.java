package fr.lapetina.gateway.provider.engine;

import fr.lapetina.gateway.provider.domain.exception.ConfigLoadException;

import java.nio.file.Path;
import java.util.Set;

/**
 * Decodes one fragment file format into a {@link ConfigFragment}.
 *
 * Implementations must be thread-safe.
 */
public interface FragmentParser {

    /**
     * Format name used in log and error messages.
     */
    String getFormat();

    /**
     * Lower-case file extensions handled by this parser, including the dot.
     */
    Set<String> getExtensions();

    /**
     * Parses the content of {@code file}.
     *
     * @throws ConfigLoadException if the content is not a valid fragment
     */
    ConfigFragment parse(Path file, byte[] content);
}
