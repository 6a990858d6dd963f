package com.stackdoc.core.pipeline;

import com.stackdoc.core.pipeline.DocumentationChecker.CheckResult;
import com.stackdoc.core.pipeline.DocumentationChecker.FileStatus;
import com.stackdoc.core.pipeline.DocumentationChecker.Status;
import com.stackdoc.core.renderer.GeneratedFile;
import com.stackdoc.core.renderer.GeneratedOutput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DocumentationChecker}.
 */
class DocumentationCheckerTest {

    @TempDir
    Path outputDir;

    private final DocumentationChecker checker = new DocumentationChecker();

    private static GeneratedOutput output(String content) {
        return new GeneratedOutput(List.of(new GeneratedFile("element.md", content, GeneratedFile.Kind.ELEMENT_REPORT)));
    }

    @Test
    void check_missingFile_isMissing() {
        CheckResult result = checker.check(output("# A\n"), outputDir);

        assertThat(result.files()).containsExactly(
            new FileStatus("element.md", GeneratedFile.Kind.ELEMENT_REPORT, Status.MISSING));
        assertThat(result.isUpToDate()).isFalse();
    }

    @Test
    void check_onlyTimestampDiffers_isCurrent() throws IOException {
        Files.writeString(outputDir.resolve("element.md"), "# A\n\n*Generated: 2020-01-01 00:00:00*\n\nBody\n");

        CheckResult result = checker.check(output("# A\n\n*Generated: 2024-05-01 09:30:00*\n\nBody\n"), outputDir);

        assertThat(result.isUpToDate()).isTrue();
    }

    @Test
    void check_bodyDiffers_isOutdated() throws IOException {
        Files.writeString(outputDir.resolve("element.md"), "# A\n\n*Generated: 2020-01-01 00:00:00*\n\nOld\n");

        CheckResult result = checker.check(output("# A\n\n*Generated: 2024-05-01 09:30:00*\n\nNew\n"), outputDir);

        assertThat(result.stale()).containsExactly(
            new FileStatus("element.md", GeneratedFile.Kind.ELEMENT_REPORT, Status.OUTDATED));
    }

    @Test
    void check_reportsKindOfEachFile() throws IOException {
        Files.writeString(outputDir.resolve("README.md"), "# Index\n");
        GeneratedOutput expected = new GeneratedOutput(List.of(
            new GeneratedFile("element.md", "# A\n", GeneratedFile.Kind.ELEMENT_REPORT),
            new GeneratedFile("README.md", "# Index\n", GeneratedFile.Kind.INDEX)));

        CheckResult result = checker.check(expected, outputDir);

        assertThat(result.files()).containsExactly(
            new FileStatus("element.md", GeneratedFile.Kind.ELEMENT_REPORT, Status.MISSING),
            new FileStatus("README.md", GeneratedFile.Kind.INDEX, Status.CURRENT));
        assertThat(result.files().get(1).isIndex()).isTrue();
        assertThat(expected.filesOf(GeneratedFile.Kind.INDEX)).extracting(GeneratedFile::relativePath)
            .containsExactly("README.md");
    }

    @Test
    void check_timestampTextInsideBody_isStillCompared() throws IOException {
        Files.writeString(outputDir.resolve("element.md"), "Text *Generated: 2020-01-01 00:00:00* inline\n");

        CheckResult result = checker.check(output("Text *Generated: 2024-05-01 09:30:00* inline\n"), outputDir);

        assertThat(result.isUpToDate()).isFalse();
    }
}
