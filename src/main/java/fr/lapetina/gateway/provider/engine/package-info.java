/**
 * Loading, caching and resolution of configuration bundles.
 *
 * <h2>Reload Flow</h2>
 * <pre>
 * validate sources → load fragments → merge → fingerprint → build index → publish
 * </pre>
 * <p>Only the last step is visible to readers. A failure at any earlier step leaves
 * the published index untouched.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.gateway.provider.engine.ConfigurationEngine} - Facade used by the HTTP layer</li>
 *   <li>{@link fr.lapetina.gateway.provider.engine.ReloadCoordinator} - Serializes reloads</li>
 *   <li>{@link fr.lapetina.gateway.provider.engine.Resolver} - Lock-free lookups against one index generation</li>
 *   <li>{@link fr.lapetina.gateway.provider.engine.BundleLoader} - Walks and merges fragment directories</li>
 * </ul>
 */
package fr.lapetina.gateway.provider.engine;
