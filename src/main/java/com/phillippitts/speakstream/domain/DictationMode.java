package com.phillippitts.speakstream.domain;

/**
 * How the remote service should treat the dictated audio.
 *
 * <p>{@link #TRANSCRIBE} produces plain text for insertion; {@link #EDIT} asks the
 * service to rewrite the currently selected text according to the spoken instruction.
 */
public enum DictationMode {
    TRANSCRIBE,
    EDIT
}
