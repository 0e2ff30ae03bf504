package fr.lapetina.gateway.provider.domain.exception;

import fr.lapetina.gateway.provider.domain.model.ErrorType;

import java.nio.file.Path;

/**
 * Thrown when a fragment directory cannot be walked, a fragment cannot be read,
 * or a fragment does not parse as its declared format.
 */
public final class ConfigLoadException extends ProviderException {

    private final Path path;

    public ConfigLoadException(Path path, String message) {
        super(ErrorType.CONFIG_LOAD_ERROR, message + ": " + path);
        this.path = path;
    }

    public ConfigLoadException(Path path, String message, Throwable cause) {
        super(ErrorType.CONFIG_LOAD_ERROR, message + ": " + path, cause);
        this.path = path;
    }

    /**
     * The file or directory that failed.
     */
    public Path getPath() {
        return path;
    }
}
