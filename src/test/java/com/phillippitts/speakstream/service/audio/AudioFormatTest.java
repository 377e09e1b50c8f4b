package com.phillippitts.speakstream.service.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AudioFormatTest {

    @Test
    void durationMsFloorsToWholeMilliseconds() {
        assertThat(AudioFormat.durationMs(3200, 16_000)).isEqualTo(100);
        assertThat(AudioFormat.durationMs(3199, 16_000)).isEqualTo(99);
        assertThat(AudioFormat.durationMs(31, 16_000)).isZero();
    }

    @Test
    void durationMsIsZeroForInvalidInput() {
        assertThat(AudioFormat.durationMs(0, 16_000)).isZero();
        assertThat(AudioFormat.durationMs(3200, 0)).isZero();
    }

    @Test
    void bytesForIsInverseOfDuration() {
        assertThat(AudioFormat.bytesFor(100, 16_000)).isEqualTo(3200);
        assertThat(AudioFormat.bytesFor(99, 16_000)).isEqualTo(3168);
    }
}
