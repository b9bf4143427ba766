package com.phillippitts.audiogen.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
    }

    @Test
    void previewCollapsesWhitespace() {
        assertThat(LogSanitizer.preview("  first line\n\nsecond\tline  ", 80))
                .isEqualTo("first line second line");
    }

    @Test
    void previewMarksTruncation() {
        assertThat(LogSanitizer.preview("a".repeat(100), 10)).isEqualTo("a".repeat(10) + "...");
        assertThat(LogSanitizer.preview("short", 5)).isEqualTo("short");
    }
}
