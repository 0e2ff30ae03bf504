package fr.lapetina.gateway.provider.domain.exception;

import fr.lapetina.gateway.provider.domain.model.ErrorType;

/**
 * Thrown when a set of configuration sources cannot form a consistent index.
 *
 * This occurs when:
 * - Two sources derive the same canonical key
 * - More than one source is marked default
 * - A source directory is missing or not a directory
 * - Basic auth is declared without username or password
 * - A source declares one metadata key in two different cases
 */
public final class ValidationException extends ProviderException {

    private final Reason reason;

    public ValidationException(Reason reason, String details) {
        super(ErrorType.VALIDATION_ERROR, reason.getMessage() + ": " + details);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        NO_SOURCES("At least one configuration is required"),
        DUPLICATE_KEY("Duplicate configuration id"),
        MULTIPLE_DEFAULTS("Only one configuration can be marked as default"),
        MISSING_DIRECTORY("Configuration directory is required"),
        DIRECTORY_NOT_FOUND("Configuration directory does not exist"),
        INCOMPLETE_BASIC_AUTH("Basic auth requires both username and password"),
        CONFLICTING_METADATA_KEYS("Metadata keys must be unique ignoring case");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
