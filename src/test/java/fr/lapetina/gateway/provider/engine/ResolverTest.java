package fr.lapetina.gateway.provider.engine;

import fr.lapetina.gateway.provider.domain.exception.ConfigNotFoundException;
import fr.lapetina.gateway.provider.domain.exception.IndexInconsistencyException;
import fr.lapetina.gateway.provider.domain.matching.ScoreBasedSourceMatcher;
import fr.lapetina.gateway.provider.domain.model.ConfigurationSource;
import fr.lapetina.gateway.provider.domain.model.ErrorType;
import fr.lapetina.gateway.provider.domain.model.ProviderIndex;
import fr.lapetina.gateway.provider.domain.model.Resolution;
import fr.lapetina.gateway.provider.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static fr.lapetina.gateway.provider.TestFixtures.defaultSource;
import static fr.lapetina.gateway.provider.TestFixtures.fragmentDir;
import static fr.lapetina.gateway.provider.TestFixtures.indexBuilder;
import static fr.lapetina.gateway.provider.TestFixtures.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResolverTest {

    @TempDir
    Path root;

    private MetricsRegistry metricsRegistry;
    private CacheStore cacheStore;
    private Resolver resolver;

    private ConfigurationSource prod;
    private ConfigurationSource staging;
    private ConfigurationSource prodEu;
    private ConfigurationSource fallback;

    @BeforeEach
    void setUp() {
        metricsRegistry = new MetricsRegistry();
        cacheStore = new CacheStore();
        resolver = new Resolver(cacheStore, new ScoreBasedSourceMatcher(), metricsRegistry);

        prod = source(fragmentDir(root, "prod", "api"), "env", "prod");
        staging = source(fragmentDir(root, "staging", "api"), "env", "staging");
        prodEu = source(fragmentDir(root, "prod-eu", "api"), "env", "prod", "region", "eu");
        fallback = defaultSource(fragmentDir(root, "default", "web"));
    }

    @AfterEach
    void tearDown() {
        metricsRegistry.close();
    }

    private void publish(ConfigurationSource... sources) {
        cacheStore.publish(indexBuilder().build(List.of(sources), 1));
    }

    @Test
    @DisplayName("should resolve exact matches and fall back to the default")
    void shouldResolveWithFallback() {
        publish(prod, staging, fallback);

        assertThat(resolver.resolve(Map.of("env", "prod")).source()).isEqualTo(prod);
        assertThat(resolver.resolve(Map.of("env", "qa")).source()).isEqualTo(fallback);
        assertThat(resolver.resolve(Map.of()).source()).isEqualTo(fallback);
    }

    @Test
    @DisplayName("should prefer the source matching more keys")
    void shouldPreferMoreSpecificSource() {
        publish(prod, prodEu);

        Resolution resolution = resolver.resolve(Map.of("region", "eu", "env", "prod"));

        assertThat(resolution.source()).isEqualTo(prodEu);
        assertThat(resolution.bundle().metadata()).containsEntry("origin", "prod-eu");
    }

    @Test
    @DisplayName("should return the bundle of the matched source")
    void shouldReturnMatchingBundle() {
        publish(prod, staging);

        Resolution resolution = resolver.resolve(Map.of("env", "staging"));

        assertThat(resolution.bundle().metadata())
                .containsEntry("origin", "staging")
                .containsEntry("env", "staging");
        assertThat(resolution.generation()).isEqualTo(1);
    }

    @Test
    @DisplayName("should fail with not-found without a default")
    void shouldFailWithoutDefault() {
        publish(prod, staging);

        assertThatThrownBy(() -> resolver.resolve(Map.of("env", "qa")))
                .isInstanceOf(ConfigNotFoundException.class)
                .extracting(e -> ((ConfigNotFoundException) e).getErrorType())
                .isEqualTo(ErrorType.NOT_FOUND);
        assertThat(resolver.getMisses()).isEqualTo(1);
    }

    @Test
    @DisplayName("should fail with not-found before the first load")
    void shouldFailOnEmptyIndex() {
        assertThatThrownBy(() -> resolver.resolve(Map.of("env", "prod")))
                .isInstanceOf(ConfigNotFoundException.class);
    }

    @Test
    @DisplayName("should report a missing cache entry as an internal error")
    void shouldReportMissingEntryAsInternalError() {
        cacheStore.publish(new ProviderIndex(3, List.of(prod), Map.of(), null, Instant.now()));

        assertThatThrownBy(() -> resolver.resolve(Map.of("env", "prod")))
                .isInstanceOf(IndexInconsistencyException.class)
                .hasMessageContaining("env=prod")
                .extracting(e -> ((IndexInconsistencyException) e).getErrorType())
                .isEqualTo(ErrorType.INTERNAL_ERROR);
    }

    @Test
    @DisplayName("should return identical results without an intervening reload")
    void shouldBePure() {
        publish(prod, staging, fallback);
        Map<String, String> request = Map.of("env", "staging", "team", "core");

        Resolution first = resolver.resolve(request);
        Resolution second = resolver.resolve(request);

        assertThat(second).isEqualTo(first);
        assertThat(resolver.getHits()).isEqualTo(2);
    }

    @Test
    @DisplayName("should accept null metadata as empty")
    void shouldAcceptNullMetadata() {
        publish(prod, fallback);

        assertThat(resolver.resolve(null).source()).isEqualTo(fallback);
    }

    @Test
    @DisplayName("should look up sources by id")
    void shouldLookUpSourceById() {
        publish(prod, fallback);

        assertThat(resolver.sourceFor("env=prod")).contains(prod);
        assertThat(resolver.sourceFor("env=unknown")).isEmpty();
    }
}
