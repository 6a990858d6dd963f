package com.stackdoc.core.pipeline;

import com.stackdoc.core.TestFixtures;
import com.stackdoc.core.model.ElementMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ManifestLoader}.
 */
class ManifestLoaderTest {

    @TempDir
    Path stackRoot;

    @Test
    void load_validManifest_readsNameAndDescription() throws IOException {
        Path element = TestFixtures.writeElement(stackRoot, "example-policy", null, TestFixtures.EXAMPLE_CHART);

        ElementMetadata metadata = ManifestLoader.load(element, "Chart.yaml");

        assertThat(metadata.identifier()).isEqualTo("example-policy");
        assertThat(metadata.displayName()).isEqualTo("Example Policy");
        assertThat(metadata.description()).isEqualTo("Example policy library element");
    }

    @Test
    void load_missingManifest_fallsBackToDirectoryName() throws IOException {
        Path element = TestFixtures.writeElement(stackRoot, "no-chart", null, null);

        assertThat(ManifestLoader.load(element, "Chart.yaml")).isEqualTo(ElementMetadata.fallback("no-chart"));
    }

    @Test
    void load_invalidManifest_fallsBackToDirectoryName() throws IOException {
        Path element = TestFixtures.writeElement(stackRoot, "bad-chart", null, "name: [unclosed\n");

        assertThat(ManifestLoader.load(element, "Chart.yaml")).isEqualTo(ElementMetadata.fallback("bad-chart"));
    }

    @Test
    void load_manifestWithoutName_keepsDescription() throws IOException {
        Path element = TestFixtures.writeElement(stackRoot, "partial", null, "description: Only a description\n");

        ElementMetadata metadata = ManifestLoader.load(element, "Chart.yaml");

        assertThat(metadata.displayName()).isEqualTo("partial");
        assertThat(metadata.description()).isEqualTo("Only a description");
    }
}
