package io.tiller.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tiller.core.hook.ManifestParseException;
import io.tiller.core.release.v1.Hook;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Extracts hooks from rendered manifests.
///
/// A document is a hook when it carries the {@link #HOOK_ANNOTATION} annotation. The
/// annotations map onto the v1 {@link Hook} as follows:
///
/// | Annotation | Hook field |
/// |---|---|
/// | `tiller.sh/hook` | events, comma separated |
/// | `tiller.sh/hook-weight` | weight, `0` if absent or not a number |
/// | `tiller.sh/hook-delete-policy` | delete policies, comma separated |
/// | `tiller.sh/hook-output-log-policy` | output-log policies, comma separated |
///
/// Unknown event and policy names are skipped with a warning.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe.
public class YamlHookParser {

    private static final Logger logger = Logger.getLogger(YamlHookParser.class.getName());

    public static final String HOOK_ANNOTATION = "tiller.sh/hook";
    public static final String WEIGHT_ANNOTATION = "tiller.sh/hook-weight";
    public static final String DELETE_POLICY_ANNOTATION = "tiller.sh/hook-delete-policy";
    public static final String OUTPUT_LOG_POLICY_ANNOTATION = "tiller.sh/hook-output-log-policy";

    private static final Pattern DOCUMENT_SEPARATOR = Pattern.compile("(?m)^---[ \\t]*$");

    private final ObjectMapper mapper;

    public YamlHookParser() {
        this(TillerYaml.createMapper());
    }

    /// @param mapper YAML mapper, not null
    public YamlHookParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /// Extracts every hook of a multi-document manifest, in document order.
    ///
    /// @param path template path recorded on each hook, not null
    /// @param manifest rendered documents, not null
    /// @return hooks found, never null, may be empty
    /// @throws ManifestParseException if a document is not valid YAML
    public List<Hook> parseAll(String path, String manifest) throws ManifestParseException {
        Objects.requireNonNull(manifest, "manifest must not be null");
        List<Hook> hooks = new ArrayList<>();
        for (String document : DOCUMENT_SEPARATOR.split(manifest)) {
            parse(path, document).ifPresent(hooks::add);
        }
        return hooks;
    }

    /// Converts one document into a hook.
    ///
    /// @param path template path recorded on the hook, not null
    /// @param document one rendered document, not null
    /// @return the hook, or empty if the document carries no hook annotation
    /// @throws ManifestParseException if the document is not valid YAML or has no name
    public Optional<Hook> parse(String path, String document) throws ManifestParseException {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(document, "document must not be null");
        if (document.isBlank()) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = mapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new ManifestParseException(
                    "Failed to parse hook manifest " + path + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        JsonNode annotations = root.path("metadata").path("annotations");
        String events = annotations.path(HOOK_ANNOTATION).asText("");
        if (events.isBlank()) {
            return Optional.empty();
        }
        String name = root.path("metadata").path("name").asText("");
        if (name.isBlank()) {
            throw new ManifestParseException("Hook manifest " + path + " has no metadata.name");
        }

        Hook.Builder builder =
                Hook.builder()
                        .name(name)
                        .kind(root.path("kind").asText(""))
                        .path(path)
                        .manifest(document.strip())
                        .weight(parseWeight(path, annotations.path(WEIGHT_ANNOTATION).asText("")));

        for (String value : split(events)) {
            try {
                builder.event(Hook.Event.fromValue(value));
            } catch (IllegalArgumentException e) {
                logger.warning("Skipping unknown hook event '" + value + "' in " + path);
            }
        }
        for (String value : split(annotations.path(DELETE_POLICY_ANNOTATION).asText(""))) {
            try {
                builder.deletePolicy(Hook.DeletePolicy.fromValue(value));
            } catch (IllegalArgumentException e) {
                logger.warning("Skipping unknown hook delete policy '" + value + "' in " + path);
            }
        }
        for (String value : split(annotations.path(OUTPUT_LOG_POLICY_ANNOTATION).asText(""))) {
            try {
                builder.outputLogPolicy(Hook.OutputLogPolicy.fromValue(value));
            } catch (IllegalArgumentException e) {
                logger.warning("Skipping unknown hook output log policy '" + value + "' in " + path);
            }
        }
        return Optional.of(builder.build());
    }

    private static int parseWeight(String path, String value) {
        if (value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            logger.fine("Ignoring invalid hook weight '" + value + "' in " + path);
            return 0;
        }
    }

    private static List<String> split(String list) {
        List<String> values = new ArrayList<>();
        for (String item : list.split(",")) {
            String value = item.strip();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }
}
