package com.phillippitts.speakstream.service.hotkey;

import java.util.Locale;
import java.util.Set;

/**
 * Library-independent key event with canonical upper-case key and modifier names.
 */
public record NormalizedKeyEvent(Type type, String key, Set<String> modifiers, long whenMillis) {

    public enum Type { PRESSED, RELEASED }

    public NormalizedKeyEvent {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        key = key.toUpperCase(Locale.ROOT);
        modifiers = modifiers == null ? Set.of()
                : Set.copyOf(modifiers.stream().map(m -> m.toUpperCase(Locale.ROOT)).toList());
    }
}
