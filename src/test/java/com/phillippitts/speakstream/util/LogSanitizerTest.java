package com.phillippitts.speakstream.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncatesLongText() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hi", 5)).isEqualTo("hi");
    }

    @Test
    void nullOrNonPositiveMaxYieldsEmpty() {
        assertThat(LogSanitizer.truncate(null, 5)).isEmpty();
        assertThat(LogSanitizer.truncate("hello", 0)).isEmpty();
    }
}
