package com.stackdoc.core.generator;

import com.stackdoc.core.TestFixtures;
import com.stackdoc.core.model.DanglingReference;
import com.stackdoc.core.model.ElementMetadata;
import com.stackdoc.core.model.ElementSummary;
import com.stackdoc.core.model.PolicyKind;
import com.stackdoc.core.model.SummaryStatistics;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link IndexGenerator}.
 */
class IndexGeneratorTest {

    private final IndexGenerator generator = new IndexGenerator(TestFixtures.FIXED_CLOCK);

    private static ElementSummary summary(String identifier, String description, List<DanglingReference> dangling) {
        return new ElementSummary(new ElementMetadata(identifier, identifier, description),
            identifier + ".md", SummaryStatistics.empty(), dangling, List.of());
    }

    @Test
    void generate_linksElementsSortedByIdentifier() {
        String content = generator.generate(List.of(
            summary("zeta", "", List.of()),
            summary("alpha", "First element", List.of())));

        assertThat(content)
            .startsWith("# PolicyStack Documentation Index\n\n" + TestFixtures.FIXED_TIMESTAMP_LINE + "\n")
            .containsSubsequence("- [alpha](./alpha.md) - First element", "- [zeta](./zeta.md)");
    }

    @Test
    void generate_noElements_saysSo() {
        assertThat(generator.generate(List.of())).contains("No elements documented yet.");
    }

    @Test
    void generate_flagsElementsWithWarnings() {
        String content = generator.generate(List.of(summary("beta", "", List.of(
            new DanglingReference("Policy", "p", PolicyKind.CONFIG_POLICY, "x")))));

        assertThat(content).contains("- [beta](./beta.md) (⚠️ 1 warning)");
    }

    @Test
    void generate_includesNotationGuide() {
        assertThat(generator.generate(List.of()))
            .contains("## Comment Notation Guide")
            .contains("### Basic Usage")
            .contains("### Nested Field Descriptions")
            .contains("### Array Item Descriptions")
            .contains("## Notes")
            .endsWith("`stackdoc validate`\n");
    }
}
