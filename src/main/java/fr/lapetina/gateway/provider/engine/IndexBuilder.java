package fr.lapetina.gateway.provider.engine;

import fr.lapetina.gateway.provider.domain.exception.ConfigLoadException;
import fr.lapetina.gateway.provider.domain.exception.ValidationException;
import fr.lapetina.gateway.provider.domain.exception.ValidationException.Reason;
import fr.lapetina.gateway.provider.domain.model.AuthRequirement;
import fr.lapetina.gateway.provider.domain.model.CacheEntry;
import fr.lapetina.gateway.provider.domain.model.ConfigBundle;
import fr.lapetina.gateway.provider.domain.model.ConfigurationSource;
import fr.lapetina.gateway.provider.domain.model.ProviderIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a list of sources and loads them into a new, unpublished
 * {@link ProviderIndex}. Has no shared state; concurrent builds are safe.
 */
public final class IndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);

    private final BundleLoader bundleLoader;
    private final FingerprintCalculator fingerprintCalculator;
    private final Duration cacheTtl;
    private final Clock clock;

    public IndexBuilder(BundleLoader bundleLoader, FingerprintCalculator fingerprintCalculator,
                        Duration cacheTtl, Clock clock) {
        this.bundleLoader = bundleLoader;
        this.fingerprintCalculator = fingerprintCalculator;
        this.cacheTtl = cacheTtl;
        this.clock = clock;
    }

    /**
     * Validates the sources, then loads, merges and fingerprints each one.
     *
     * @throws ValidationException if the sources cannot form a consistent index
     * @throws ConfigLoadException if any source directory fails to load
     */
    public ProviderIndex build(List<ConfigurationSource> sources, long generation) {
        validate(sources);

        Map<String, CacheEntry> cache = new LinkedHashMap<>();
        String defaultId = null;

        for (ConfigurationSource source : sources) {
            ConfigBundle bundle;
            try {
                bundle = bundleLoader.load(source.getDirectory());
            } catch (ConfigLoadException e) {
                log.warn("Failed to load config {} from {}", source.getId(), source.getDirectory());
                throw e;
            }

            bundle = bundle.withMetadata(source.getDeclaredMetadata());
            String fingerprint = fingerprintCalculator.fingerprint(bundle);
            Instant loadedAt = clock.instant();
            bundle = bundle.withFingerprint(fingerprint).withLoadedAt(loadedAt);

            cache.put(source.getId(), new CacheEntry(bundle, loadedAt.plus(cacheTtl), fingerprint));
            if (source.isDefault()) {
                defaultId = source.getId();
            }

            log.debug("Loaded config {}: routes={}, middlewares={}, checksum={}",
                    source.getId(), bundle.routes().size(), bundle.middlewares().size(), fingerprint);
        }

        return new ProviderIndex(generation, sources, cache, defaultId, clock.instant());
    }

    /**
     * Checks every invariant that must hold over the whole source list.
     *
     * @throws ValidationException on the first violation found
     */
    public void validate(List<ConfigurationSource> sources) {
        if (sources == null || sources.isEmpty()) {
            throw new ValidationException(Reason.NO_SOURCES, "no configurations declared");
        }

        Map<String, Integer> seenIds = new HashMap<>();
        int defaultCount = 0;

        for (int i = 0; i < sources.size(); i++) {
            ConfigurationSource source = sources.get(i);

            if (source.getDirectory() == null || source.getDirectory().toString().isEmpty()) {
                throw new ValidationException(Reason.MISSING_DIRECTORY, "configuration[" + i + "]");
            }
            if (!Files.isDirectory(source.getDirectory())) {
                throw new ValidationException(Reason.DIRECTORY_NOT_FOUND,
                        "configuration[" + i + "]: " + source.getDirectory());
            }

            AuthRequirement.BasicAuth basicAuth = source.getAuthRequirement().basicAuth();
            if (basicAuth != null && (isBlank(basicAuth.username()) || isBlank(basicAuth.password()))) {
                throw new ValidationException(Reason.INCOMPLETE_BASIC_AUTH, "configuration[" + i + "]");
            }

            if (source.getDeclaredMetadata().isEmpty() && !source.isDefault()) {
                log.warn("Empty metadata for configuration[{}], it can only be selected by key '{}'", i, source.getId());
            }

            Integer previous = seenIds.putIfAbsent(source.getId(), i);
            if (previous != null) {
                throw new ValidationException(Reason.DUPLICATE_KEY,
                        source.getId() + " (configuration[" + previous + "] and configuration[" + i + "])");
            }

            if (source.isDefault()) {
                defaultCount++;
            }
        }

        if (defaultCount > 1) {
            throw new ValidationException(Reason.MULTIPLE_DEFAULTS, defaultCount + " configurations marked default");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
