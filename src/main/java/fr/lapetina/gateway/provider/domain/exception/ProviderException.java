package fr.lapetina.gateway.provider.domain.exception;

import fr.lapetina.gateway.provider.domain.model.ErrorType;

/**
 * Base class for every failure raised by the configuration engine.
 */
public class ProviderException extends RuntimeException {

    private final ErrorType errorType;

    public ProviderException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ProviderException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
