package com.stackdoc.core.generator;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValueFormatter}.
 */
class ValueFormatterTest {

    @Test
    void format_booleans_renderCanonicalLiterals() {
        assertThat(ValueFormatter.format(true)).isEqualTo("`true`");
        assertThat(ValueFormatter.format(false)).isEqualTo("`false`");
    }

    @Test
    void format_null_rendersNotSet() {
        assertThat(ValueFormatter.format(null)).isEqualTo(ValueFormatter.NOT_SET);
    }

    @Test
    void format_scalarWithPipeAndNewline_staysInOneCell() {
        assertThat(ValueFormatter.format("a|b\nc")).isEqualTo("`a\\|b c`");
    }

    @Test
    void format_scalarList_joinsLiterals() {
        assertThat(ValueFormatter.format(List.of("CM", 2))).isEqualTo("`CM`, `2`");
        assertThat(ValueFormatter.format(List.of())).isEqualTo("_empty_");
    }

    @Test
    void isPresent_emptyValues_areAbsent() {
        assertThat(ValueFormatter.isPresent(null)).isFalse();
        assertThat(ValueFormatter.isPresent(" ")).isFalse();
        assertThat(ValueFormatter.isPresent(List.of())).isFalse();
        assertThat(ValueFormatter.isPresent(Map.of())).isFalse();
        assertThat(ValueFormatter.isPresent(false)).isTrue();
    }
}
