package fr.lapetina.gateway.provider.domain.exception;

import fr.lapetina.gateway.provider.domain.model.ErrorType;

/**
 * Request credentials were rejected for the matched configuration.
 */
public final class AuthenticationException extends ProviderException {

    public AuthenticationException(String sourceId) {
        super(ErrorType.UNAUTHORIZED, "Authentication failed for config " + sourceId);
    }
}
