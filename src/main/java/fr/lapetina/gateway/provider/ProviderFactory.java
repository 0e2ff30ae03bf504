package fr.lapetina.gateway.provider;

import fr.lapetina.gateway.provider.domain.exception.ProviderException;
import fr.lapetina.gateway.provider.domain.matching.ScoreBasedSourceMatcher;
import fr.lapetina.gateway.provider.domain.model.ConfigurationSource;
import fr.lapetina.gateway.provider.engine.BundleLoader;
import fr.lapetina.gateway.provider.engine.CacheStore;
import fr.lapetina.gateway.provider.engine.ConfigurationEngine;
import fr.lapetina.gateway.provider.engine.FingerprintCalculator;
import fr.lapetina.gateway.provider.engine.IndexBuilder;
import fr.lapetina.gateway.provider.engine.ReloadCoordinator;
import fr.lapetina.gateway.provider.engine.Resolver;
import fr.lapetina.gateway.provider.infrastructure.config.ConfigLoader;
import fr.lapetina.gateway.provider.infrastructure.config.ProviderConfig;
import fr.lapetina.gateway.provider.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.gateway.provider.infrastructure.scheduling.PeriodicReloadScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Factory for creating a fully-wired configuration engine from the provider
 * configuration file. The initial load runs in the constructor, so a factory
 * that was created successfully always serves a complete index.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ProviderFactory factory = ProviderFactory.create("config.yaml").start()) {
 *     Resolution resolution = factory.getEngine().resolve(Map.of("env", "prod"));
 *     // use resolution.bundle()...
 * }
 * }</pre>
 */
public class ProviderFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderFactory.class);

    private final ConfigLoader configLoader;
    private final ProviderConfig config;
    private final MetricsRegistry metricsRegistry;
    private final CacheStore cacheStore;
    private final ReloadCoordinator reloadCoordinator;
    private final ConfigurationEngine engine;
    private PeriodicReloadScheduler reloadScheduler;

    protected ProviderFactory(ConfigLoader configLoader, Clock clock) {
        log.info("Initializing ProviderFactory from config: {}", configLoader.getConfigPath());

        // Load configuration
        this.configLoader = configLoader;
        this.config = configLoader.load();
        List<ConfigurationSource> sources = config.toSources();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Build engine
        IndexBuilder indexBuilder = new IndexBuilder(
                BundleLoader.withDefaultParsers(),
                new FingerprintCalculator(),
                Duration.ofMillis(config.getCache().getTtlMs()),
                clock
        );
        this.cacheStore = new CacheStore();
        this.reloadCoordinator = new ReloadCoordinator(sources, indexBuilder, cacheStore, metricsRegistry);
        Resolver resolver = new Resolver(cacheStore, new ScoreBasedSourceMatcher(), metricsRegistry);
        this.engine = new ConfigurationEngine(resolver, reloadCoordinator, cacheStore, clock);

        // Initial load; failures abort startup
        try {
            reloadCoordinator.reload();
        } catch (RuntimeException e) {
            metricsRegistry.close();
            throw e;
        }

        metricsRegistry.registerIndexGauges(
                () -> cacheStore.current().size(),
                () -> cacheStore.current().getGeneration()
        );

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        log.info("ProviderFactory initialized with {} configurations", cacheStore.current().size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ProviderFactory create(String configPath) {
        return new ProviderFactory(new ConfigLoader(configPath), Clock.systemUTC());
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static ProviderFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the file watcher and periodic reload, as configured.
     */
    public ProviderFactory start() {
        if (config.getReload().isWatchConfigFile()) {
            configLoader.startWatching();
        }
        if (config.getReload().getIntervalMs() > 0) {
            reloadScheduler = new PeriodicReloadScheduler(
                    reloadCoordinator, Duration.ofMillis(config.getReload().getIntervalMs()));
            reloadScheduler.start();
        }
        log.info("Provider started");
        return this;
    }

    public ConfigurationEngine getEngine() {
        return engine;
    }

    public ReloadCoordinator getReloadCoordinator() {
        return reloadCoordinator;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    /**
     * The configuration loaded at startup. Server settings are not hot-reloaded.
     */
    public ProviderConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private void onConfigChanged(ProviderConfig oldConfig, ProviderConfig newConfig) {
        log.info("Configuration changed, reloading {} configurations...", newConfig.getConfigurations().size());
        try {
            reloadCoordinator.reload(newConfig.toSources());
        } catch (ProviderException e) {
            log.warn("Changed configuration rejected, still serving generation {}",
                    cacheStore.current().getGeneration());
        }
    }

    @Override
    public void close() {
        if (reloadScheduler != null) {
            reloadScheduler.close();
        }
        configLoader.close();
        metricsRegistry.close();
        log.info("ProviderFactory closed");
    }
}
