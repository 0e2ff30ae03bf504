package fr.lapetina.gateway.provider.engine;

import fr.lapetina.gateway.provider.domain.exception.ConfigLoadException;
import fr.lapetina.gateway.provider.domain.exception.ValidationException;
import fr.lapetina.gateway.provider.domain.model.AuthRequirement;
import fr.lapetina.gateway.provider.domain.model.CacheEntry;
import fr.lapetina.gateway.provider.domain.model.ConfigurationSource;
import fr.lapetina.gateway.provider.domain.model.ProviderIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static fr.lapetina.gateway.provider.TestFixtures.NOW;
import static fr.lapetina.gateway.provider.TestFixtures.TTL;
import static fr.lapetina.gateway.provider.TestFixtures.defaultSource;
import static fr.lapetina.gateway.provider.TestFixtures.fragmentDir;
import static fr.lapetina.gateway.provider.TestFixtures.indexBuilder;
import static fr.lapetina.gateway.provider.TestFixtures.source;
import static fr.lapetina.gateway.provider.TestFixtures.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexBuilderTest {

    @TempDir
    Path root;

    private IndexBuilder builder;
    private Path prodDir;
    private Path defaultDir;

    @BeforeEach
    void setUp() {
        builder = indexBuilder();
        prodDir = fragmentDir(root, "prod", "api");
        defaultDir = fragmentDir(root, "default", "web");
    }

    @Nested
    @DisplayName("building")
    class Building {

        @Test
        @DisplayName("should load, merge metadata and fingerprint every source")
        void shouldBuildIndex() {
            ProviderIndex index = builder.build(List.of(
                    source(prodDir, "env", "prod"),
                    defaultSource(defaultDir)
            ), 7);

            assertThat(index.getGeneration()).isEqualTo(7);
            assertThat(index.getSources()).extracting(ConfigurationSource::getId)
                    .containsExactly("env=prod", "default");
            assertThat(index.getDefaultId()).contains("default");
            assertThat(index.getLastReloadAt()).isEqualTo(NOW);

            CacheEntry prod = index.getEntry("env=prod").orElseThrow();
            assertThat(prod.bundle().metadata())
                    .containsEntry("origin", "prod")
                    .containsEntry("env", "prod");
            assertThat(prod.fingerprint()).hasSize(64).isEqualTo(prod.bundle().fingerprint());
            assertThat(prod.bundle().loadedAt()).isEqualTo(NOW);
            assertThat(prod.expiresAt()).isEqualTo(NOW.plus(TTL));
        }

        @Test
        @DisplayName("should let declared metadata override fragment metadata")
        void shouldOverlayDeclaredMetadata() {
            write(prodDir, "meta.yaml", "metadata:\n  env: from-fragment\n");

            ProviderIndex index = builder.build(List.of(source(prodDir, "env", "prod")), 1);

            assertThat(index.getEntry("env=prod").orElseThrow().bundle().metadata())
                    .containsEntry("env", "prod");
        }

        @Test
        @DisplayName("should produce identical fingerprints for identical content")
        void shouldProduceStableFingerprints() {
            String first = builder.build(List.of(source(prodDir, "env", "prod")), 1)
                    .getEntry("env=prod").orElseThrow().fingerprint();
            String second = builder.build(List.of(source(prodDir, "env", "prod")), 2)
                    .getEntry("env=prod").orElseThrow().fingerprint();

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("should leave default id empty when no source is default")
        void shouldHaveNoDefault() {
            ProviderIndex index = builder.build(List.of(source(prodDir, "env", "prod")), 1);

            assertThat(index.getDefaultId()).isEmpty();
            assertThat(index.getDefaultSource()).isEmpty();
        }

        @Test
        @DisplayName("should propagate fragment failures")
        void shouldPropagateLoadFailure() {
            write(prodDir, "broken.json", "{");

            assertThatThrownBy(() -> builder.build(List.of(source(prodDir, "env", "prod")), 1))
                    .isInstanceOf(ConfigLoadException.class);
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should reject duplicate derived keys")
        void shouldRejectDuplicateKeys() {
            assertThatThrownBy(() -> builder.validate(List.of(
                    source(prodDir, "env", "prod"),
                    source(defaultDir, "env", "prod"))))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getReason())
                    .isEqualTo(ValidationException.Reason.DUPLICATE_KEY);
        }

        @Test
        @DisplayName("should reject keys that only differ by case")
        void shouldRejectCaseInsensitiveDuplicates() {
            assertThatThrownBy(() -> builder.validate(List.of(
                    source(prodDir, "env", "Prod"),
                    source(defaultDir, "ENV", "prod"))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("env=prod");
        }

        @Test
        @DisplayName("should reject more than one default")
        void shouldRejectMultipleDefaults() {
            assertThatThrownBy(() -> builder.validate(List.of(
                    defaultSource(prodDir, "env", "prod"),
                    defaultSource(defaultDir))))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getReason())
                    .isEqualTo(ValidationException.Reason.MULTIPLE_DEFAULTS);
        }

        @Test
        @DisplayName("should reject a directory that does not exist")
        void shouldRejectMissingDirectory() {
            assertThatThrownBy(() -> builder.validate(List.of(source(root.resolve("nope"), "env", "prod"))))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getReason())
                    .isEqualTo(ValidationException.Reason.DIRECTORY_NOT_FOUND);
        }

        @Test
        @DisplayName("should reject a path that is a file")
        void shouldRejectFileAsDirectory() {
            Path file = write(root, "file.yaml", "routes: []");

            assertThatThrownBy(() -> builder.validate(List.of(source(file, "env", "prod"))))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("should reject a source without directory")
        void shouldRejectBlankDirectory() {
            ConfigurationSource blank = ConfigurationSource.builder().directory("  ").metadata("env", "prod").build();

            assertThatThrownBy(() -> builder.validate(List.of(blank)))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getReason())
                    .isEqualTo(ValidationException.Reason.MISSING_DIRECTORY);
        }

        @Test
        @DisplayName("should reject basic auth without password")
        void shouldRejectIncompleteBasicAuth() {
            ConfigurationSource source = ConfigurationSource.builder()
                    .directory(prodDir)
                    .metadata("env", "prod")
                    .auth(AuthRequirement.basic("admin", ""))
                    .build();

            assertThatThrownBy(() -> builder.validate(List.of(source)))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getReason())
                    .isEqualTo(ValidationException.Reason.INCOMPLETE_BASIC_AUTH);
        }

        @Test
        @DisplayName("should reject an empty source list")
        void shouldRejectNoSources() {
            assertThatThrownBy(() -> builder.validate(List.of()))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getReason())
                    .isEqualTo(ValidationException.Reason.NO_SOURCES);
        }

        @Test
        @DisplayName("should validate the whole list before loading any fragment")
        void shouldValidateBeforeLoading() {
            write(prodDir, "broken.json", "{");

            assertThatThrownBy(() -> builder.build(List.of(
                    source(prodDir, "env", "prod"),
                    source(defaultDir, "env", "prod")), 1))
                    .isInstanceOf(ValidationException.class);
        }
    }
}
