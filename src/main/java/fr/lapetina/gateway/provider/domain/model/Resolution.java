package fr.lapetina.gateway.provider.domain.model;

/**
 * Result of resolving request metadata: the matched source, its bundle, and
 * the index generation both were read from.
 */
public record Resolution(ConfigurationSource source, ConfigBundle bundle, long generation) {
}
