package io.tiller.core.chart;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ChartTest {

    @Nested
    class Builder {

        @Test
        void shouldDeclareSubchartsAsDependencies() {
            // When
            Chart chart =
                    Chart.builder("app")
                            .dependency(ChartDependency.of("api", "db"))
                            .subchart(Chart.builder("api").build())
                            .subchart(Chart.builder("db").build())
                            .build();

            // Then
            assertThat(chart.getMetadata().dependencies())
                    .extracting(ChartDependency::name)
                    .containsExactly("api", "db");
            assertThat(chart.getMetadata().dependency("api").orElseThrow().dependsOn())
                    .containsExactly("db");
            assertThat(chart.subchart("db")).isPresent();
            assertThat(chart.hasSubcharts()).isTrue();
        }

        @Test
        void shouldRejectDuplicateSubchartNames() {
            Chart.Builder builder =
                    Chart.builder("app")
                            .subchart(Chart.builder("db").build())
                            .subchart(Chart.builder("db").build());

            assertThatThrownBy(builder::build)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("'db' more than once");
        }
    }

    @Nested
    class DependsOnAnnotation {

        private ChartMetadata metadata(String value) {
            return new ChartMetadata(
                    "x", "1.0.0", Map.of(ChartMetadata.DEPENDS_ON_ANNOTATION, value), null);
        }

        @Test
        void shouldParseCommaSeparatedList() {
            assertThat(metadata("nginx, rabbitmq,nginx").annotatedDependsOn())
                    .containsExactly("nginx", "rabbitmq");
        }

        @Test
        void shouldParseBracketedList() {
            assertThat(metadata("[\"nginx\", 'rabbitmq']").annotatedDependsOn())
                    .containsExactly("nginx", "rabbitmq");
        }

        @Test
        void shouldBeEmptyWithoutAnnotation() {
            assertThat(Chart.builder("x").build().getMetadata().annotatedDependsOn()).isEmpty();
            assertThat(metadata("  ").annotatedDependsOn()).isEmpty();
        }
    }

    @Test
    void shouldRenderTemplatesVerbatim() throws Exception {
        // Given
        Chart chart =
                Chart.builder("web")
                        .template("a.yaml", "kind: A\n")
                        .template("empty.yaml", "")
                        .template("b.yaml", "kind: B\n")
                        .subchart(Chart.builder("sub").template("s.yaml", "kind: S").build())
                        .build();

        // When
        String rendered = ManifestRenderer.verbatim().render(chart);

        // Then
        assertThat(rendered).isEqualTo("kind: A\n---\nkind: B");
    }
}
