package io.tiller.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tiller.core.hook.ManifestMetadataReader;
import io.tiller.core.hook.ManifestParseException;
import java.util.Objects;
import java.util.Optional;

/// Jackson YAML implementation of {@link ManifestMetadataReader}.
///
/// Reads the first document of a manifest as a tree and looks up
/// `metadata.namespace`. An empty manifest has no namespace.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe.
public class YamlManifestMetadataReader implements ManifestMetadataReader {

    private final ObjectMapper mapper;

    public YamlManifestMetadataReader() {
        this(TillerYaml.createMapper());
    }

    /// @param mapper YAML mapper, not null
    public YamlManifestMetadataReader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public Optional<String> readNamespace(String manifest) throws ManifestParseException {
        Objects.requireNonNull(manifest, "manifest must not be null");
        if (manifest.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = mapper.readTree(manifest);
            if (root == null || !root.isObject()) {
                return Optional.empty();
            }
            JsonNode namespace = root.path("metadata").path("namespace");
            if (!namespace.isValueNode() || namespace.asText().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(namespace.asText());
        } catch (JsonProcessingException e) {
            throw new ManifestParseException(
                    "Failed to parse manifest metadata: " + e.getOriginalMessage(), e);
        }
    }
}
