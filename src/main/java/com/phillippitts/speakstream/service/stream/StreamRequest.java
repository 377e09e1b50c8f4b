package com.phillippitts.speakstream.service.stream;

import com.phillippitts.speakstream.domain.AudioFrame;

/**
 * One item of the outbound stream: exactly one of an audio frame or a control message.
 */
public record StreamRequest(AudioFrame audio, ControlMessage control) {

    public StreamRequest {
        if ((audio == null) == (control == null)) {
            throw new IllegalArgumentException("Exactly one of audio or control must be set");
        }
    }

    public static StreamRequest audio(AudioFrame frame) {
        return new StreamRequest(frame, null);
    }

    public static StreamRequest control(ControlMessage message) {
        return new StreamRequest(null, message);
    }

    public boolean isAudio() {
        return audio != null;
    }
}
