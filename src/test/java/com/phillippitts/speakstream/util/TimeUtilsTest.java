package com.phillippitts.speakstream.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void convertsNanosToWholeMillis() {
        assertThat(TimeUtils.nanosToMillis(1_999_999L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(250_000_000L)).isEqualTo(250L);
    }
}
