package io.tiller.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tiller.core.hook.ManifestParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class YamlManifestMetadataReaderTest {

    private YamlManifestMetadataReader reader;

    @BeforeEach
    void setUp() {
        reader = new YamlManifestMetadataReader();
    }

    @Test
    void shouldReadNamespace() throws Exception {
        String manifest =
                "apiVersion: batch/v1\n"
                        + "kind: Job\n"
                        + "metadata:\n"
                        + "  name: migrate\n"
                        + "  namespace: foo\n";

        assertThat(reader.readNamespace(manifest)).contains("foo");
    }

    @Test
    void shouldReturnEmptyWithoutNamespace() throws Exception {
        assertThat(reader.readNamespace("kind: Job\nmetadata:\n  name: migrate\n")).isEmpty();
        assertThat(reader.readNamespace("kind: Job\nmetadata:\n  namespace: \"\"\n")).isEmpty();
    }

    @Test
    void shouldReturnEmptyForBlankOrScalarDocument() throws Exception {
        assertThat(reader.readNamespace("   ")).isEmpty();
        assertThat(reader.readNamespace("just a string")).isEmpty();
    }

    @Test
    void shouldFailOnInvalidYaml() {
        assertThatThrownBy(() -> reader.readNamespace("metadata: {namespace: foo"))
                .isInstanceOf(ManifestParseException.class);
    }
}
