package fr.lapetina.gateway.provider.infrastructure.config;

import fr.lapetina.gateway.provider.domain.model.AuthRequirement;
import fr.lapetina.gateway.provider.domain.model.ConfigurationSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the provider, bound from the YAML file by
 * {@link ConfigLoader}.
 */
public class ProviderConfig {

    private String version = "1";
    private ServerConfig server = new ServerConfig();
    private MetadataConfig metadata = new MetadataConfig();
    private CacheConfig cache = new CacheConfig();
    private ReloadConfig reload = new ReloadConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private List<SourceConfig> configurations = new ArrayList<>();

    // Getters and Setters
    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public MetadataConfig getMetadata() { return metadata; }
    public void setMetadata(MetadataConfig metadata) { this.metadata = metadata; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public ReloadConfig getReload() { return reload; }
    public void setReload(ReloadConfig reload) { this.reload = reload; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public List<SourceConfig> getConfigurations() { return configurations; }
    public void setConfigurations(List<SourceConfig> configurations) { this.configurations = configurations; }

    /**
     * Applies environment overrides. Only {@code PORT} is recognized.
     */
    public ProviderConfig applyEnvironment(Map<String, String> env) {
        String port = env.get("PORT");
        if (port != null && !port.isBlank()) {
            try {
                server.setPort(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigLoader.ConfigurationException("Invalid PORT value: " + port, e);
            }
        }
        return this;
    }

    /**
     * Converts the declared configurations to engine sources, in declaration order.
     */
    public List<ConfigurationSource> toSources() {
        List<ConfigurationSource> sources = new ArrayList<>();
        if (configurations == null) {
            return sources;
        }
        for (SourceConfig sourceConfig : configurations) {
            sources.add(sourceConfig.toSource());
        }
        return sources;
    }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 16;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Request metadata extraction.
     */
    public static class MetadataConfig {
        private String headerPrefix = "X-Goma-Meta-";
        private boolean includeQueryParameters = true;

        public String getHeaderPrefix() { return headerPrefix; }
        public void setHeaderPrefix(String headerPrefix) { this.headerPrefix = headerPrefix; }

        public boolean isIncludeQueryParameters() { return includeQueryParameters; }
        public void setIncludeQueryParameters(boolean includeQueryParameters) { this.includeQueryParameters = includeQueryParameters; }
    }

    /**
     * Cache entry lifetime, used for expiry stamps and Cache-Control.
     */
    public static class CacheConfig {
        private long ttlMs = 300000;

        public long getTtlMs() { return ttlMs; }
        public void setTtlMs(long ttlMs) { this.ttlMs = ttlMs; }
    }

    /**
     * Reload triggers.
     */
    public static class ReloadConfig {
        private boolean watchConfigFile = true;
        private long intervalMs = 0;

        public boolean isWatchConfigFile() { return watchConfigFile; }
        public void setWatchConfigFile(boolean watchConfigFile) { this.watchConfigFile = watchConfigFile; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "config_provider";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    /**
     * One configuration source: a fragment directory and the metadata it serves.
     */
    public static class SourceConfig {
        private String id;
        private String directory;
        private boolean defaultSource;
        private Map<String, String> metadata = new LinkedHashMap<>();
        private AuthConfig auth;

        /** Ignored; ids are derived from metadata. Accepted for older files. */
        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public boolean isDefault() { return defaultSource; }
        public void setDefault(boolean defaultSource) { this.defaultSource = defaultSource; }

        public Map<String, String> getMetadata() { return metadata; }
        public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }

        public AuthConfig getAuth() { return auth; }
        public void setAuth(AuthConfig auth) { this.auth = auth; }

        public ConfigurationSource toSource() {
            Map<String, String> declared = new LinkedHashMap<>();
            if (metadata != null) {
                metadata.forEach((k, v) -> declared.put(k, v == null ? "" : v));
            }
            return ConfigurationSource.builder()
                    .directory(directory)
                    .metadata(declared)
                    .auth(auth != null ? auth.toRequirement() : null)
                    .isDefault(defaultSource)
                    .build();
        }
    }

    /**
     * Credentials required for a source.
     */
    public static class AuthConfig {
        private String apiKey;
        private BasicAuthConfig basicAuth;

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public BasicAuthConfig getBasicAuth() { return basicAuth; }
        public void setBasicAuth(BasicAuthConfig basicAuth) { this.basicAuth = basicAuth; }

        public AuthRequirement toRequirement() {
            return new AuthRequirement(
                    apiKey,
                    basicAuth != null
                            ? new AuthRequirement.BasicAuth(basicAuth.getUsername(), basicAuth.getPassword())
                            : null
            );
        }
    }

    public static class BasicAuthConfig {
        private String username;
        private String password;

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }
}
