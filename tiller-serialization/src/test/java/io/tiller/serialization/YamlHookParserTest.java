package io.tiller.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tiller.core.hook.ManifestParseException;
import io.tiller.core.release.v1.Hook;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class YamlHookParserTest {

    private YamlHookParser parser;

    @BeforeEach
    void setUp() {
        parser = new YamlHookParser();
    }

    private static String job(String name, String annotations) {
        return "apiVersion: batch/v1\n"
                + "kind: Job\n"
                + "metadata:\n"
                + "  name: "
                + name
                + "\n"
                + "  annotations:\n"
                + annotations;
    }

    @Nested
    class Parse {

        @Test
        void shouldMapAnnotations() throws Exception {
            // Given
            String document =
                    job(
                            "migrate",
                            "    tiller.sh/hook: pre-install,pre-upgrade\n"
                                    + "    tiller.sh/hook-weight: \"-5\"\n"
                                    + "    tiller.sh/hook-delete-policy: before-hook-creation,hook-succeeded\n"
                                    + "    tiller.sh/hook-output-log-policy: hook-failed\n");

            // When
            Optional<Hook> parsed = parser.parse("templates/migrate.yaml", document);

            // Then
            assertThat(parsed).isPresent();
            Hook hook = parsed.get();
            assertThat(hook.getName()).isEqualTo("migrate");
            assertThat(hook.getKind()).isEqualTo("Job");
            assertThat(hook.getPath()).isEqualTo("templates/migrate.yaml");
            assertThat(hook.getWeight()).isEqualTo(-5);
            assertThat(hook.getEvents())
                    .containsExactly(Hook.Event.PRE_INSTALL, Hook.Event.PRE_UPGRADE);
            assertThat(hook.getDeletePolicies())
                    .containsExactly(
                            Hook.DeletePolicy.BEFORE_HOOK_CREATION, Hook.DeletePolicy.HOOK_SUCCEEDED);
            assertThat(hook.getOutputLogPolicies())
                    .containsExactly(Hook.OutputLogPolicy.HOOK_FAILED);
            assertThat(hook.getManifest()).startsWith("apiVersion: batch/v1");
        }

        @Test
        void shouldIgnoreDocumentWithoutHookAnnotation() throws Exception {
            String document = "kind: ConfigMap\nmetadata:\n  name: settings\n";

            assertThat(parser.parse("templates/settings.yaml", document)).isEmpty();
        }

        @Test
        void shouldSkipUnknownValues() throws Exception {
            String document =
                    job(
                            "smoke",
                            "    tiller.sh/hook: test, sometime\n"
                                    + "    tiller.sh/hook-delete-policy: never\n");

            Hook hook = parser.parse("templates/smoke.yaml", document).orElseThrow();

            assertThat(hook.getEvents()).containsExactly(Hook.Event.TEST);
            assertThat(hook.getDeletePolicies()).isEmpty();
        }

        @Test
        void shouldDefaultInvalidWeightToZero() throws Exception {
            String document =
                    job(
                            "smoke",
                            "    tiller.sh/hook: test\n" + "    tiller.sh/hook-weight: heavy\n");

            assertThat(parser.parse("templates/smoke.yaml", document).orElseThrow().getWeight())
                    .isZero();
        }

        @Test
        void shouldRejectHookWithoutName() {
            String document =
                    "kind: Job\nmetadata:\n  annotations:\n    tiller.sh/hook: pre-install\n";

            assertThatThrownBy(() -> parser.parse("templates/job.yaml", document))
                    .isInstanceOf(ManifestParseException.class)
                    .hasMessageContaining("templates/job.yaml");
        }

        @Test
        void shouldRejectInvalidYaml() {
            assertThatThrownBy(() -> parser.parse("templates/bad.yaml", "metadata: [oops"))
                    .isInstanceOf(ManifestParseException.class);
        }
    }

    @Nested
    class ParseAll {

        @Test
        void shouldCollectHooksInDocumentOrder() throws Exception {
            // Given
            String manifest =
                    job("first", "    tiller.sh/hook: pre-install\n")
                            + "---\n"
                            + "kind: ConfigMap\nmetadata:\n  name: settings\n"
                            + "---\n"
                            + job("second", "    tiller.sh/hook: post-install\n");

            // When
            List<Hook> hooks = parser.parseAll("templates/hooks.yaml", manifest);

            // Then
            assertThat(hooks).extracting(Hook::getName).containsExactly("first", "second");
            assertThat(hooks.get(1).getEvents()).containsExactly(Hook.Event.POST_INSTALL);
        }

        @Test
        void shouldReturnEmptyForBlankManifest() throws Exception {
            assertThat(parser.parseAll("templates/none.yaml", "")).isEmpty();
        }
    }
}
