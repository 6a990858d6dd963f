package com.stackdoc.core.pipeline;

import com.stackdoc.core.TestFixtures;
import com.stackdoc.core.generator.ElementReport;
import com.stackdoc.core.renderer.GeneratedFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DocumentationPipeline}.
 */
class DocumentationPipelineTest {

    @TempDir
    Path tempDir;

    private Path stackRoot;
    private DocumentationPipeline pipeline;

    @BeforeEach
    void setUp() throws IOException {
        stackRoot = Files.createDirectories(tempDir.resolve("stack"));
        pipeline = new DocumentationPipeline(TestFixtures.FIXED_CLOCK);
    }

    private PipelineRequest request(String elementFilter) {
        return new PipelineRequest(stackRoot, elementFilter, "values.yaml", "Chart.yaml", "README.md");
    }

    @Test
    void run_generatesReportPerElementAndIndex() throws IOException {
        TestFixtures.writeElement(stackRoot, "example-policy", TestFixtures.EXAMPLE_VALUES, TestFixtures.EXAMPLE_CHART);
        TestFixtures.writeElement(stackRoot, "another", "stack:\n  another:\n    enable: true\n", null);

        PipelineResult result = pipeline.run(request(null));

        assertThat(result.exitCode()).isZero();
        assertThat(result.reports()).extracting(ElementReport::identifier).containsExactly("another", "example-policy");
        assertThat(result.output().files()).extracting(GeneratedFile::relativePath)
            .containsExactly("another.md", "example-policy.md", "README.md");
        assertThat(result.output().find("example-policy.md")).hasValueSatisfying(file ->
            assertThat(file.content()).startsWith("# Example Policy - Policy Library Documentation"));
        assertThat(result.output().find("README.md")).hasValueSatisfying(file ->
            assertThat(file.content()).contains("- [Example Policy](./example-policy.md)"));
    }

    @Test
    void run_malformedElement_doesNotStopTheBatch() throws IOException {
        TestFixtures.writeElement(stackRoot, "broken", "stack:\n  broken:\n    enable: true\n  x: y: z\n", null);
        TestFixtures.writeElement(stackRoot, "healthy", "stack:\n  healthy:\n    enable: true\n", null);

        PipelineResult result = pipeline.run(request(null));

        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.identifier()).isEqualTo("broken");
            assertThat(failure.lineNumber()).isEqualTo(4);
        });
        assertThat(result.reports()).extracting(ElementReport::identifier).containsExactly("healthy");
        assertThat(result.exitCode()).isEqualTo(1);
    }

    @Test
    void run_elementWithoutValues_isSkipped() throws IOException {
        TestFixtures.writeElement(stackRoot, "empty-dir", null, TestFixtures.EXAMPLE_CHART);
        TestFixtures.writeElement(stackRoot, "healthy", "stack:\n  healthy:\n    enable: true\n", null);

        PipelineResult result = pipeline.run(request(null));

        assertThat(result.skipped()).containsExactly("empty-dir");
        assertThat(result.exitCode()).isZero();
    }

    @Test
    void run_hiddenDirectoriesAreIgnored() throws IOException {
        TestFixtures.writeElement(stackRoot, ".git", "a: 1\n", null);
        TestFixtures.writeElement(stackRoot, "healthy", "stack:\n  healthy:\n    enable: true\n", null);

        assertThat(pipeline.run(request(null)).reports()).hasSize(1);
    }

    @Test
    void run_elementFilter_generatesOnlyThatElementWithoutIndex() throws IOException {
        TestFixtures.writeElement(stackRoot, "example-policy", TestFixtures.EXAMPLE_VALUES, null);
        TestFixtures.writeElement(stackRoot, "another", "stack:\n  another:\n    enable: true\n", null);

        PipelineResult result = pipeline.run(request("example-policy"));

        assertThat(result.output().files()).extracting(GeneratedFile::relativePath)
            .containsExactly("example-policy.md");
    }

    @Test
    void run_unknownElementFilter_throws() {
        assertThatThrownBy(() -> pipeline.run(request("nope")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nope");
    }

    @Test
    void run_emptyStack_exitsNonZero() {
        PipelineResult result = pipeline.run(request(null));

        assertThat(result.discovered()).isZero();
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.output().find("README.md")).hasValueSatisfying(file ->
            assertThat(file.content()).contains("No elements documented yet."));
    }

    @Test
    void run_twiceOnSameInput_producesIdenticalOutput() throws IOException {
        TestFixtures.writeElement(stackRoot, "example-policy", TestFixtures.EXAMPLE_VALUES, TestFixtures.EXAMPLE_CHART);

        assertThat(pipeline.run(request(null)).output()).isEqualTo(pipeline.run(request(null)).output());
    }

    @Test
    void validate_reportsParseErrorsAndUnboundDescriptions() throws IOException {
        TestFixtures.writeElement(stackRoot, "broken", "a: b: c\n", null);
        TestFixtures.writeElement(stackRoot, "loose", "key: 1\n# @desc: trailing\n", null);

        assertThat(pipeline.validate(request(null))).satisfiesExactly(
            broken -> assertThat(broken.isValid()).isFalse(),
            loose -> {
                assertThat(loose.isValid()).isTrue();
                assertThat(loose.unboundDescriptions()).hasSize(1);
            });
    }
}
