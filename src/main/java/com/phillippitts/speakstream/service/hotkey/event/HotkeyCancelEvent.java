package com.phillippitts.speakstream.service.hotkey.event;

import java.time.Instant;

/** Published when the cancel key is pressed during dictation. */
public record HotkeyCancelEvent(Instant at) { }
