/**
 * Configuration loading and hot-reload support.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.gateway.provider.infrastructure.config.ProviderConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.gateway.provider.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.gateway.provider.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (host, port, backlog, worker threads)</li>
 *   <li>{@code metadata} - Header prefix and query parameter extraction</li>
 *   <li>{@code cache} - Bundle TTL, also used for {@code Cache-Control}</li>
 *   <li>{@code reload} - File watching and periodic reload</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 *   <li>{@code configurations} - The sources to serve</li>
 * </ul>
 *
 * <p>The {@code PORT} environment variable overrides {@code server.port}.
 *
 * @see fr.lapetina.gateway.provider.infrastructure.config.ConfigLoader
 */
package fr.lapetina.gateway.provider.infrastructure.config;
