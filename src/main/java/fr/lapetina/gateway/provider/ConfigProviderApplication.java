package fr.lapetina.gateway.provider;

import fr.lapetina.gateway.provider.api.Authenticator;
import fr.lapetina.gateway.provider.api.HttpServer;
import fr.lapetina.gateway.provider.api.MetadataExtractor;
import fr.lapetina.gateway.provider.infrastructure.config.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Gateway Config Provider.
 */
public class ConfigProviderApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigProviderApplication.class);

    private final ProviderFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public ConfigProviderApplication(String configPath) throws Exception {
        this(ProviderFactory.create(configPath));
    }

    ConfigProviderApplication(ProviderFactory factory) throws Exception {
        log.info("Starting Gateway Config Provider...");

        this.factory = factory.start();

        ProviderConfig config = factory.getConfig();
        ProviderConfig.ServerConfig server = config.getServer();
        this.httpServer = new HttpServer(
                server.getHost(),
                server.getPort(),
                server.getBacklog(),
                server.getWorkerThreads(),
                factory.getEngine(),
                new MetadataExtractor(
                        config.getMetadata().getHeaderPrefix(),
                        config.getMetadata().isIncludeQueryParameters()),
                new Authenticator(),
                factory.getMetricsRegistry(),
                Duration.ofMillis(config.getCache().getTtlMs()),
                config.getMetrics().isEnabled()
        );

        log.info("Gateway Config Provider initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Gateway Config Provider started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down Gateway Config Provider...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Gateway Config Provider shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            ConfigProviderApplication app = new ConfigProviderApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Gateway Config Provider", e);
            System.exit(1);
        }
    }
}
