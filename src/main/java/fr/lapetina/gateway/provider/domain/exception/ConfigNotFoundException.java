package fr.lapetina.gateway.provider.domain.exception;

import fr.lapetina.gateway.provider.domain.model.ErrorType;

import java.util.Map;

/**
 * No source matched the request metadata and no default source is declared.
 * A normal per-request outcome, not a system fault.
 */
public final class ConfigNotFoundException extends ProviderException {

    public ConfigNotFoundException(Map<String, String> requestMetadata) {
        super(ErrorType.NOT_FOUND, "No configuration matched metadata " + requestMetadata);
    }
}
