package io.tiller.core.hook;

import java.util.Optional;

/// Reads object metadata out of raw manifest text.
///
/// Only the fields the hook engine needs are exposed. Implementations live outside
/// the core so that it stays free of a YAML parser.
///
/// The YAML implementation lives in the `tiller-serialization` module.
@FunctionalInterface
public interface ManifestMetadataReader {

    /// Reads `metadata.namespace` of the first document.
    ///
    /// @param manifest manifest text, not null
    /// @return the namespace, or empty if the field is absent or blank
    /// @throws ManifestParseException if the text is not a valid document
    Optional<String> readNamespace(String manifest) throws ManifestParseException;
}
