/**
 * Source selection from request metadata.
 *
 * <p>{@link fr.lapetina.gateway.provider.domain.matching.ScoreBasedSourceMatcher} scores each
 * source by the number of declared metadata entries the request matches exactly. The highest
 * score wins; on a tie the first declared source wins. Falling back to the default source is
 * left to the caller.
 *
 * @see fr.lapetina.gateway.provider.domain.matching.CanonicalKeys
 */
package fr.lapetina.gateway.provider.domain.matching;
