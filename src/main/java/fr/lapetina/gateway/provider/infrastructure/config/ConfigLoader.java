package fr.lapetina.gateway.provider.infrastructure.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.gateway.provider.infrastructure.yaml.YamlTreeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads the provider configuration file and keeps the last good copy.
 *
 * The file is YAML bound onto {@link ProviderConfig}. Source metadata values
 * keep their written text, so {@code release: 2024-01-01} declares the
 * string {@code 2024-01-01}. When watching is on, a change to the file
 * triggers {@link #reload()} and listeners see the old and new copies.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String SOURCE_METADATA = "configurations[].metadata";

    private final YamlTreeReader treeReader = new YamlTreeReader(Set.of(SOURCE_METADATA));
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<ProviderConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Map<String, String> environment;

    private WatchService watchService;
    private Thread watchThread;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Path.of(configPath);
        this.environment = Map.copyOf(environment);
    }

    /**
     * Reads the file, applies the environment and publishes the result.
     *
     * @throws ConfigurationException if the file is missing or invalid
     */
    public ProviderConfig load() {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigurationException("Configuration file not found: " + configPath);
        }
        log.info("Loading configuration from file: {}", configPath);
        try (InputStream in = Files.newInputStream(configPath)) {
            lastModified = Files.getLastModifiedTime(configPath).toMillis();
            return publish(parse(in, configPath.toString()));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration from: " + configPath, e);
        }
    }

    public ProviderConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream, "stream"));
    }

    private ProviderConfig publish(ProviderConfig config) {
        config.applyEnvironment(environment);
        ProviderConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private ProviderConfig parse(InputStream in, String origin) {
        JsonNode tree;
        try {
            tree = treeReader.read(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid provider configuration in " + origin, e);
        }
        if (tree == null || tree.isNull()) {
            throw new ConfigurationException("Provider configuration is empty: " + origin);
        }
        try {
            return objectMapper.treeToValue(tree, ProviderConfig.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid provider configuration in " + origin + ": " + e.getMessage(), e);
        }
    }

    public ProviderConfig getCurrentConfig() {
        return currentConfig.get();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Watches the file's directory on a daemon thread. A missing file disables
     * watching.
     */
    public synchronized void startWatching() {
        if (watchThread != null) {
            return;
        }
        if (!Files.isRegularFile(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }
        Path directory = configPath.toAbsolutePath().getParent();
        try {
            watchService = directory.getFileSystem().newWatchService();
            directory.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);
        } catch (IOException e) {
            log.error("Failed to start config watcher for {}", configPath, e);
            return;
        }
        WatchService service = watchService;
        watchThread = new Thread(() -> watch(service), "config-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
        log.info("Configuration hot-reload enabled for: {}", configPath);
    }

    private void watch(WatchService service) {
        try {
            while (true) {
                WatchKey key = service.take();
                boolean touched = false;
                for (WatchEvent<?> event : key.pollEvents()) {
                    touched |= configPath.getFileName().equals(event.context());
                }
                key.reset();
                if (touched && isNewer()) {
                    log.info("Configuration file changed, reloading");
                    reload();
                }
            }
        } catch (ClosedWatchServiceException e) {
            log.debug("Config watcher closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // editors often emit several events per save
    private boolean isNewer() {
        try {
            return Files.getLastModifiedTime(configPath).toMillis() > lastModified;
        } catch (IOException e) {
            log.warn("Cannot stat {}: {}", configPath, e.getMessage());
            return false;
        }
    }

    /**
     * Like {@link #load()}, but on failure logs and returns the current configuration.
     */
    public ProviderConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ProviderConfig oldConfig, ProviderConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (RuntimeException e) {
                log.error("Config change listener {} failed", listener, e);
            }
        }
    }

    @Override
    public synchronized void close() {
        if (watchService == null) {
            return;
        }
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Error closing watch service", e);
        }
        watchService = null;
        watchThread = null;
    }

    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
