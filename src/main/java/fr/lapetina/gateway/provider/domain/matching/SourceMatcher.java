package fr.lapetina.gateway.provider.domain.matching;

import fr.lapetina.gateway.provider.domain.model.ConfigurationSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Strategy for choosing the source that best serves a request's metadata.
 *
 * Implementations must be stateless or thread-safe as they are called from
 * every request worker concurrently, and deterministic for a given input.
 */
public interface SourceMatcher {

    /**
     * Returns the name of this matcher for logging.
     */
    String getName();

    /**
     * Selects the best source by metadata alone. The default-source fallback
     * is not applied here.
     *
     * @param sources         sources in declaration order
     * @param requestMetadata metadata declared by the client, keys lower-cased
     * @return the matched source, or empty if none matches on metadata
     */
    Optional<ConfigurationSource> match(List<ConfigurationSource> sources, Map<String, String> requestMetadata);
}
