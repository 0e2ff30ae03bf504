package fr.lapetina.gateway.provider.engine;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.gateway.provider.domain.exception.ConfigLoadException;
import fr.lapetina.gateway.provider.domain.model.ConfigBundle;
import fr.lapetina.gateway.provider.domain.model.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;

import static fr.lapetina.gateway.provider.TestFixtures.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BundleLoaderTest {

    @TempDir
    Path dir;

    private BundleLoader loader;

    @BeforeEach
    void setUp() {
        loader = BundleLoader.withDefaultParsers();
    }

    @Nested
    @DisplayName("merging")
    class Merging {

        @Test
        @DisplayName("should merge YAML and JSON fragments from nested directories")
        void shouldMergeFragments() {
            write(dir, "a-routes.yaml", """
                    routes:
                      - name: api
                        path: /api
                        target: http://api:8080
                    """);
            write(dir, "nested/b-middlewares.json", """
                    {"middlewares": [{"name": "rate", "type": "rateLimit", "rule": {"unit": "minute", "requestsPerUnit": 60}}]}
                    """);
            write(dir, "nested/deeper/c-more.yml", """
                    routes:
                      - name: web
                        path: /
                    """);

            ConfigBundle bundle = loader.load(dir);

            assertThat(bundle.version()).isEqualTo(ConfigBundle.DEFAULT_VERSION);
            assertThat(bundle.routes()).extracting(node -> node.get("name").asText())
                    .containsExactly("api", "web");
            assertThat(bundle.middlewares()).hasSize(1);
            assertThat(bundle.fingerprint()).isEmpty();
            assertThat(bundle.loadedAt()).isNull();
        }

        @Test
        @DisplayName("should keep duplicate route names")
        void shouldKeepDuplicates() {
            write(dir, "a.yaml", "routes:\n  - name: api\n    path: /v1\n");
            write(dir, "b.yaml", "routes:\n  - name: api\n    path: /v2\n");

            ConfigBundle bundle = loader.load(dir);

            assertThat(bundle.routes()).extracting(node -> node.get("path").asText())
                    .containsExactly("/v1", "/v2");
        }

        @Test
        @DisplayName("should let later fragments win on metadata keys")
        void shouldApplyLastWriteWinsToMetadata() {
            write(dir, "a.yaml", "metadata:\n  owner: team-a\n  tier: gold\n");
            write(dir, "b.json", "{\"metadata\": {\"owner\": \"team-b\"}}");

            ConfigBundle bundle = loader.load(dir);

            assertThat(bundle.metadata())
                    .containsEntry("owner", "team-b")
                    .containsEntry("tier", "gold");
        }

        @Test
        @DisplayName("should render scalar metadata values as text")
        void shouldRenderScalarMetadataAsText() {
            write(dir, "a.yaml", "metadata:\n  replicas: 3\n  canary: true\n  empty:\n");

            ConfigBundle bundle = loader.load(dir);

            assertThat(bundle.metadata())
                    .containsEntry("replicas", "3")
                    .containsEntry("canary", "true")
                    .containsEntry("empty", "");
        }

        @Test
        @DisplayName("should pass middleware rules through untouched")
        void shouldPassRulesThrough() {
            write(dir, "mw.yaml", """
                    middlewares:
                      - name: access
                        type: accessPolicy
                        rule:
                          action: DENY
                          sourceRanges: [10.0.0.0/8, 192.168.0.1]
                    """);

            JsonNode rule = loader.load(dir).middlewares().get(0).get("rule");

            assertThat(rule.get("action").asText()).isEqualTo("DENY");
            assertThat(rule.get("sourceRanges")).hasSize(2);
        }

        @Test
        @DisplayName("should skip unrecognized files and accept an empty YAML file")
        void shouldSkipUnrecognizedFiles() {
            write(dir, "README.md", "# not a fragment");
            write(dir, "notes.txt", "routes: [broken");
            write(dir, "empty.yaml", "");
            write(dir, "UPPER.YAML", "routes:\n  - name: upper\n");

            ConfigBundle bundle = loader.load(dir);

            assertThat(bundle.routes()).extracting(node -> node.get("name").asText()).containsExactly("upper");
        }

        @Test
        @DisplayName("should return an empty bundle for an empty directory")
        void shouldLoadEmptyDirectory() {
            ConfigBundle bundle = loader.load(dir);

            assertThat(bundle.routes()).isEmpty();
            assertThat(bundle.middlewares()).isEmpty();
            assertThat(bundle.metadata()).isEmpty();
        }
    }

    @Nested
    @DisplayName("scalar values")
    class Scalars {

        @Test
        @DisplayName("should keep dates, yes/no words and decimal scale as written")
        void shouldKeepScalarsAsWritten() {
            write(dir, "routes.yaml", """
                    routes:
                      - name: api
                        since: 2024-01-01
                        enabled: yes
                        sticky: off
                        weight: 1.10
                        retries: 3
                        strict: true
                        port: 010
                    metadata:
                      released: 2024-01-01
                      version: 1.10
                      beta: on
                      flag: True
                    """);

            ConfigBundle bundle = loader.load(dir);

            JsonNode route = bundle.routes().get(0);
            assertThat(route.get("since").isTextual()).isTrue();
            assertThat(route.get("since").asText()).isEqualTo("2024-01-01");
            assertThat(route.get("enabled").asText()).isEqualTo("yes");
            assertThat(route.get("sticky").asText()).isEqualTo("off");
            assertThat(route.get("weight").isNumber()).isTrue();
            assertThat(route.get("weight").decimalValue()).isEqualTo(new BigDecimal("1.10"));
            assertThat(route.get("weight").toString()).isEqualTo("1.10");
            assertThat(route.get("retries").isInt()).isTrue();
            assertThat(route.get("retries").intValue()).isEqualTo(3);
            assertThat(route.get("strict").isBoolean()).isTrue();
            assertThat(route.get("port").intValue()).isEqualTo(10);

            assertThat(bundle.metadata())
                    .containsEntry("released", "2024-01-01")
                    .containsEntry("version", "1.10")
                    .containsEntry("beta", "on")
                    .containsEntry("flag", "True");
        }

        @Test
        @DisplayName("should keep decimal scale in JSON fragments")
        void shouldKeepJsonDecimalScale() {
            write(dir, "r.json", "{\"routes\": [{\"name\": \"api\", \"weight\": 1.10}], \"metadata\": {\"version\": 2.50}}");

            ConfigBundle bundle = loader.load(dir);

            assertThat(bundle.routes().get(0).get("weight").toString()).isEqualTo("1.10");
            assertThat(bundle.metadata()).containsEntry("version", "2.50");
        }

        @Test
        @DisplayName("should fingerprint 1.10 and 1.1 differently")
        void shouldDistinguishDecimalScale() {
            Path a = dir.resolve("a");
            Path b = dir.resolve("b");
            write(a, "r.yaml", "routes:\n  - name: api\n    weight: 1.10\n");
            write(b, "r.yaml", "routes:\n  - name: api\n    weight: 1.1\n");
            FingerprintCalculator calculator = new FingerprintCalculator();

            assertThat(calculator.fingerprint(loader.load(a)))
                    .isNotEqualTo(calculator.fingerprint(loader.load(b)));
        }

        @Test
        @DisplayName("should resolve anchors and merge keys")
        void shouldResolveMergeKeys() {
            write(dir, "mw.yaml", """
                    defaults: &defaults
                      type: rateLimit
                      rule:
                        unit: minute
                    middlewares:
                      - <<: *defaults
                        name: slow
                      - <<: *defaults
                        name: fast
                        type: burst
                    """);

            ConfigBundle bundle = loader.load(dir);

            assertThat(bundle.middlewares()).extracting(node -> node.get("type").asText())
                    .containsExactly("rateLimit", "burst");
            assertThat(bundle.middlewares().get(0).has("<<")).isFalse();
            assertThat(bundle.middlewares().get(1).get("rule").get("unit").asText()).isEqualTo("minute");
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should fail the whole directory on one malformed JSON file")
        void shouldFailOnMalformedJson() {
            write(dir, "good.yaml", "routes:\n  - name: api\n");
            Path bad = write(dir, "bad.json", "{\"routes\": [");

            assertThatThrownBy(() -> loader.load(dir))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse JSON")
                    .satisfies(e -> assertThat(((ConfigLoadException) e).getPath()).isEqualTo(bad))
                    .satisfies(e -> assertThat(((ConfigLoadException) e).getErrorType())
                            .isEqualTo(ErrorType.CONFIG_LOAD_ERROR));
        }

        @Test
        @DisplayName("should fail on malformed YAML")
        void shouldFailOnMalformedYaml() {
            write(dir, "bad.yaml", "routes:\n  - name: [unclosed\n");

            assertThatThrownBy(() -> loader.load(dir))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML");
        }

        @Test
        @DisplayName("should fail on duplicate YAML keys")
        void shouldFailOnDuplicateYamlKeys() {
            write(dir, "dup.yaml", "metadata:\n  env: a\n  env: b\n");

            assertThatThrownBy(() -> loader.load(dir)).isInstanceOf(ConfigLoadException.class);
        }

        @Test
        @DisplayName("should fail on an empty JSON file")
        void shouldFailOnEmptyJson() {
            write(dir, "empty.json", "");

            assertThatThrownBy(() -> loader.load(dir))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("empty document");
        }

        @Test
        @DisplayName("should fail when routes is not a sequence")
        void shouldFailOnWrongShape() {
            write(dir, "shape.yaml", "routes:\n  name: api\n");

            assertThatThrownBy(() -> loader.load(dir))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("'routes' must be a sequence");
        }

        @Test
        @DisplayName("should fail when the document root is not a mapping")
        void shouldFailOnNonMappingRoot() {
            write(dir, "list.json", "[1, 2, 3]");

            assertThatThrownBy(() -> loader.load(dir))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("expected a mapping");
        }

        @Test
        @DisplayName("should fail on nested metadata values")
        void shouldFailOnNestedMetadata() {
            write(dir, "meta.yaml", "metadata:\n  owner:\n    name: a\n");

            assertThatThrownBy(() -> loader.load(dir))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("must be a scalar");
        }

        @Test
        @DisplayName("should fail for a missing directory")
        void shouldFailForMissingDirectory() {
            assertThatThrownBy(() -> loader.load(dir.resolve("missing")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to walk directory");
        }
    }
}
