package com.stackdoc.core.generator;

import com.stackdoc.core.TestFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GenerationTimestamp}.
 */
class GenerationTimestampTest {

    @Test
    void line_formatsClockInstant() {
        assertThat(GenerationTimestamp.line(TestFixtures.FIXED_CLOCK)).isEqualTo(TestFixtures.FIXED_TIMESTAMP_LINE);
    }

    @Test
    void normalize_replacesOnlyStandaloneTimestampLines() {
        String content = "# A\n\n*Generated: 2024-05-01 09:30:00*\n\nSee *Generated: 2024-05-01 09:30:00* inline\n";

        assertThat(GenerationTimestamp.normalize(content))
            .isEqualTo("# A\n\n*Generated: TIMESTAMP*\n\nSee *Generated: 2024-05-01 09:30:00* inline\n");
    }
}
