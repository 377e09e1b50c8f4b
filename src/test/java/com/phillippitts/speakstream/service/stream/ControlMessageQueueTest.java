package com.phillippitts.speakstream.service.stream;

import com.phillippitts.speakstream.domain.AudioFrame;
import com.phillippitts.speakstream.domain.DictationMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ControlMessageQueueTest {

    @Test
    void drainReturnsMessagesInFifoOrderAndEmptiesQueue() {
        ControlMessageQueue queue = new ControlMessageQueue();
        ModeUpdate edit = new ModeUpdate(DictationMode.EDIT);
        ModeUpdate transcribe = new ModeUpdate(DictationMode.TRANSCRIBE);
        queue.enqueue(edit);
        queue.enqueue(transcribe);

        assertThat(queue.drainPending()).containsExactly(edit, transcribe);
        assertThat(queue.size()).isZero();
        assertThat(queue.drainPending()).isEmpty();
    }

    @Test
    void clearDiscardsPendingMessages() {
        ControlMessageQueue queue = new ControlMessageQueue();
        queue.enqueue(new ModeUpdate(DictationMode.EDIT));

        queue.clear();

        assertThat(queue.drainPending()).isEmpty();
    }

    @Test
    void streamRequestHoldsExactlyOneOfAudioOrControl() {
        AudioFrame frame = new AudioFrame(new byte[2], 16_000);
        ModeUpdate mode = new ModeUpdate(DictationMode.EDIT);

        assertThatThrownBy(() -> new StreamRequest(frame, mode)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StreamRequest(null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(StreamRequest.audio(frame).isAudio()).isTrue();
        assertThat(StreamRequest.control(mode).isAudio()).isFalse();
    }
}
