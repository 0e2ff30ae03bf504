package fr.lapetina.gateway.provider.domain.exception;

import fr.lapetina.gateway.provider.domain.model.ErrorType;

/**
 * A resolved source has no cache entry in the same index generation.
 * Always a defect in index construction.
 */
public final class IndexInconsistencyException extends ProviderException {

    public IndexInconsistencyException(String sourceId, long generation) {
        super(ErrorType.INTERNAL_ERROR,
                "Config " + sourceId + " not loaded in index generation " + generation);
    }
}
