package com.phillippitts.speakstream.service.hotkey.event;

import com.phillippitts.speakstream.domain.DictationMode;

import java.time.Instant;

/**
 * Published when a dictation hotkey is pressed; {@code mode} tells which one.
 */
public record HotkeyPressedEvent(DictationMode mode, Instant at) { }
