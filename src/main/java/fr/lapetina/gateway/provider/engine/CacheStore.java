package fr.lapetina.gateway.provider.engine;

import fr.lapetina.gateway.provider.domain.model.ProviderIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the published index generation.
 *
 * Readers take one reference per operation and never lock. Publishing
 * replaces the whole generation in a single atomic write.
 */
public final class CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private final AtomicReference<ProviderIndex> current = new AtomicReference<>(ProviderIndex.empty());

    /**
     * Returns the published generation. Callers must read everything they
     * need from the returned instance rather than calling this again.
     */
    public ProviderIndex current() {
        return current.get();
    }

    /**
     * Replaces the published generation.
     *
     * @return the generation that was replaced
     */
    public ProviderIndex publish(ProviderIndex next) {
        Objects.requireNonNull(next, "Index is required");
        ProviderIndex previous = current.getAndSet(next);
        log.debug("Published index generation {} (replaced {})", next.getGeneration(), previous.getGeneration());
        return previous;
    }
}
