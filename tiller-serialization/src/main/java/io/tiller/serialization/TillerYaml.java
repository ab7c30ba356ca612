package io.tiller.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

/// Factory of the YAML mapper shared by the manifest readers.
///
/// @implNote Mappers are thread-safe once configured; callers may cache the result of
/// {@link #createMapper()}.
public final class TillerYaml {

    private TillerYaml() {}

    /// Creates a YAML mapper for reading resource manifests.
    ///
    /// Registers:
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled, manifests carry arbitrary fields
    /// - `FAIL_ON_TRAILING_TOKENS` disabled, only the first document is read
    ///
    /// @return configured mapper, never null
    public static ObjectMapper createMapper() {
        return YAMLMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }
}
