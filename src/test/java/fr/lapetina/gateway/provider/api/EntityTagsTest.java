package fr.lapetina.gateway.provider.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EntityTagsTest {

    private static final String FINGERPRINT = "9f86d081884c7d65";

    @Test
    @DisplayName("should match quoted, bare and weak tags")
    void shouldMatchTagForms() {
        assertThat(EntityTags.matches("\"" + FINGERPRINT + "\"", FINGERPRINT)).isTrue();
        assertThat(EntityTags.matches(FINGERPRINT, FINGERPRINT)).isTrue();
        assertThat(EntityTags.matches("W/\"" + FINGERPRINT + "\"", FINGERPRINT)).isTrue();
    }

    @Test
    @DisplayName("should match within a list and on wildcard")
    void shouldMatchListAndWildcard() {
        assertThat(EntityTags.matches("\"other\", \"" + FINGERPRINT + "\"", FINGERPRINT)).isTrue();
        assertThat(EntityTags.matches("*", FINGERPRINT)).isTrue();
    }

    @Test
    @DisplayName("should not match other tags or missing values")
    void shouldNotMatch() {
        assertThat(EntityTags.matches("\"other\"", FINGERPRINT)).isFalse();
        assertThat(EntityTags.matches(null, FINGERPRINT)).isFalse();
        assertThat(EntityTags.matches(" ", FINGERPRINT)).isFalse();
        assertThat(EntityTags.matches("*", "")).isFalse();
    }
}
