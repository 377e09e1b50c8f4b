package com.phillippitts.speakstream.service.hotkey.event;

import java.time.Instant;
import java.util.List;

/**
 * Published when a configured hotkey equals an OS-reserved shortcut.
 */
public record HotkeyConflictEvent(String key, List<String> modifiers, Instant at) { }
