/**
 * Gateway Config Provider - serves per-environment gateway configuration bundles.
 *
 * <p>Each configured source pairs a directory of YAML/JSON fragments with the
 * metadata it serves. Fragments are merged into one bundle per source, fingerprinted
 * and cached; requests are matched to a source by their metadata.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.gateway.provider.ProviderFactory} - Wires the engine from YAML configuration</li>
 *   <li>{@link fr.lapetina.gateway.provider.ConfigProviderApplication} - Standalone HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ProviderFactory factory = ProviderFactory.create("config.yaml").start()) {
 *     Resolution resolution = factory.getEngine().resolve(Map.of("env", "prod"));
 *     ConfigBundle bundle = resolution.bundle();
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Best-match source selection with default fallback</li>
 *   <li>Atomic reloads: readers always see one complete index generation</li>
 *   <li>Content fingerprints exposed as ETags</li>
 *   <li>Hot-reload on configuration file change, optional periodic reload</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.gateway.provider.ProviderFactory
 * @see fr.lapetina.gateway.provider.engine.ConfigurationEngine
 */
package fr.lapetina.gateway.provider;
