package fr.lapetina.gateway.provider.domain.model;

import fr.lapetina.gateway.provider.domain.exception.ValidationException;
import fr.lapetina.gateway.provider.domain.exception.ValidationException.Reason;
import fr.lapetina.gateway.provider.domain.matching.CanonicalKeys;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A declared configuration entry: where its fragments live, which client
 * metadata it serves, and which credentials it requires.
 *
 * Immutable. The id is derived from the declared metadata each time a source
 * is built, so every index generation recomputes it. Metadata keys are
 * case-insensitive; declaring the same key twice in different cases is
 * rejected.
 */
public final class ConfigurationSource {

    private final String id;
    private final Path directory;
    private final Map<String, String> declaredMetadata;
    private final AuthRequirement authRequirement;
    private final boolean isDefault;

    private ConfigurationSource(Builder builder) {
        this.directory = builder.directory;
        Map<String, String> metadataCopy = new LinkedHashMap<>();
        builder.declaredMetadata.forEach((k, v) -> {
            String key = k.toLowerCase(Locale.ROOT);
            if (metadataCopy.containsKey(key)) {
                throw new ValidationException(Reason.CONFLICTING_METADATA_KEYS,
                        "'" + key + "' declared more than once in " + builder.declaredMetadata.keySet());
            }
            metadataCopy.put(key, v);
        });
        this.declaredMetadata = Collections.unmodifiableMap(metadataCopy);
        this.authRequirement = builder.authRequirement != null ? builder.authRequirement : AuthRequirement.none();
        this.isDefault = builder.isDefault;
        this.id = CanonicalKeys.deriveKey(declaredMetadata);
    }

    public String getId() {
        return id;
    }

    /**
     * Fragment directory, or null when none was declared (rejected at index validation).
     */
    public Path getDirectory() {
        return directory;
    }

    /**
     * Declared metadata with lower-cased keys, in declaration order.
     */
    public Map<String, String> getDeclaredMetadata() {
        return declaredMetadata;
    }

    public AuthRequirement getAuthRequirement() {
        return authRequirement;
    }

    public boolean isDefault() {
        return isDefault;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConfigurationSource that = (ConfigurationSource) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ConfigurationSource{" +
                "id='" + id + '\'' +
                ", directory=" + directory +
                ", default=" + isDefault +
                ", auth=" + authRequirement +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path directory;
        private final Map<String, String> declaredMetadata = new LinkedHashMap<>();
        private AuthRequirement authRequirement;
        private boolean isDefault;

        private Builder() {
        }

        public Builder directory(Path directory) {
            this.directory = directory;
            return this;
        }

        public Builder directory(String directory) {
            this.directory = directory == null || directory.isBlank() ? null : Path.of(directory);
            return this;
        }

        public Builder metadata(String key, String value) {
            this.declaredMetadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            if (metadata != null) {
                this.declaredMetadata.putAll(metadata);
            }
            return this;
        }

        public Builder auth(AuthRequirement authRequirement) {
            this.authRequirement = authRequirement;
            return this;
        }

        public Builder isDefault(boolean isDefault) {
            this.isDefault = isDefault;
            return this;
        }

        public ConfigurationSource build() {
            return new ConfigurationSource(this);
        }
    }
}
