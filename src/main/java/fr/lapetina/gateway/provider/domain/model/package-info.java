/**
 * Domain model of the provider.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.gateway.provider.domain.model.ConfigurationSource} - A fragment directory and the metadata it serves</li>
 *   <li>{@link fr.lapetina.gateway.provider.domain.model.ConfigBundle} - Merged, fingerprinted configuration of one source</li>
 *   <li>{@link fr.lapetina.gateway.provider.domain.model.ProviderIndex} - One generation of sources and their cache entries</li>
 *   <li>{@link fr.lapetina.gateway.provider.domain.model.ErrorType} - Error categories mapped to HTTP statuses</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Every class here is immutable. A {@code ProviderIndex} is never modified
 * after construction; reloads publish a new one.
 */
package fr.lapetina.gateway.provider.domain.model;
