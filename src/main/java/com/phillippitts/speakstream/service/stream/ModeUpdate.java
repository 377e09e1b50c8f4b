package com.phillippitts.speakstream.service.stream;

import com.phillippitts.speakstream.domain.DictationMode;

import java.util.Objects;

/**
 * Changes only the dictation mode of the remote session. Carries no other field so the
 * service merges it onto previously sent context instead of replacing it.
 */
public record ModeUpdate(DictationMode mode) implements ControlMessage {

    public ModeUpdate {
        Objects.requireNonNull(mode, "mode must not be null");
    }
}
