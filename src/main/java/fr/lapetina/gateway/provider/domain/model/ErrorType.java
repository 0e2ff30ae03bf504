package fr.lapetina.gateway.provider.domain.model;

/**
 * Error taxonomy for configuration loading and resolution.
 * Provides clear categorization for error handling, HTTP mapping and metrics.
 */
public enum ErrorType {
    /** A fragment directory could not be read or a fragment failed to parse */
    CONFIG_LOAD_ERROR,

    /** Duplicate derived keys, several default sources, missing directory, etc. */
    VALIDATION_ERROR,

    /** No source matched the request metadata and no default exists */
    NOT_FOUND,

    /** Request credentials do not satisfy the matched source's requirement */
    UNAUTHORIZED,

    /** Index and cache are out of sync */
    INTERNAL_ERROR
}
