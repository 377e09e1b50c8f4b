package com.phillippitts.speakstream.service.hotkey.event;

import java.time.Instant;

/**
 * Published when the last held dictation hotkey is released (or pressed again in toggle mode).
 */
public record HotkeyReleasedEvent(Instant at) { }
