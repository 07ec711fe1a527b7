package com.draftsmith.orchestrator.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextMetricsTest {

    @Test
    void measure_latinText_countsLettersOnly() {
        assertThat(TextMetrics.measure("Hello, world! 42")).isEqualTo(10);
    }

    @Test
    void measure_textWithIdeographs_countsIdeographsOnly() {
        // Latin letters are ignored as soon as one ideograph is present.
        assertThat(TextMetrics.measure("深度学习 deep learning。")).isEqualTo(4);
    }

    @Test
    void measure_nullOrEmpty_isZero() {
        assertThat(TextMetrics.measure(null)).isZero();
        assertThat(TextMetrics.measure("")).isZero();
        assertThat(TextMetrics.measure("   \n\t")).isZero();
    }

    @Test
    void measure_digitsAndPunctuation_areNotCounted() {
        assertThat(TextMetrics.measure("1.2.3 -- ;;")).isZero();
    }

    @Test
    void ideographCount_ignoresLatinLetters() {
        assertThat(TextMetrics.ideographCount("abc 中文 def")).isEqualTo(2);
        assertThat(TextMetrics.ideographCount("abc")).isZero();
        assertThat(TextMetrics.ideographCount(null)).isZero();
    }
}
