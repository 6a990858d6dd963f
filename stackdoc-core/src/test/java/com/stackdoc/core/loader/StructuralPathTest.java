package com.stackdoc.core.loader;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link StructuralPath}.
 */
class StructuralPathTest {

    @Test
    void of_mixedSteps_rendersDottedAndIndexedForm() {
        StructuralPath path = StructuralPath.of("stack", "examplePolicy", "configPolicies", 0, "name");

        assertThat(path).hasToString("stack.examplePolicy.configPolicies[0].name");
        assertThat(path.depth()).isEqualTo(5);
        assertThat(path.lastStep()).isEqualTo("name");
    }

    @Test
    void root_isEmpty() {
        assertThat(StructuralPath.root().isRoot()).isTrue();
        assertThat(StructuralPath.root()).hasToString("<root>");
    }

    @Test
    void keyAndIndex_equalPathBuiltWithOf() {
        StructuralPath built = StructuralPath.root().key("policies").index(2).key("enabled");

        assertThat(built).isEqualTo(StructuralPath.of("policies", 2, "enabled"));
        assertThat(built.parent()).isEqualTo(StructuralPath.of("policies", 2));
    }

    @Test
    void of_unsupportedStepType_throws() {
        assertThatThrownBy(() -> StructuralPath.of("a", 1.5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
