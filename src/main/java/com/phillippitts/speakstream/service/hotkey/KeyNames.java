package com.phillippitts.speakstream.service.hotkey;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical key and modifier names shared by configuration and the native hook.
 */
public final class KeyNames {

    private static final Set<String> MODIFIERS = Set.of("META", "SHIFT", "CONTROL", "ALT");

    private KeyNames() {}

    /** Upper-cases, maps spaces to underscores and COMMAND/CMD to META. */
    public static String normalize(String name) {
        if (name == null) {
            return "UNKNOWN";
        }
        String k = name.trim().toUpperCase(Locale.ROOT)
                .replace(' ', '_')
                .replace("COMMAND", "META")
                .replace("CMD", "META")
                .replace("OPTION", "ALT");
        if ("ESC".equals(k)) {
            return "ESCAPE";
        }
        return k;
    }

    public static Set<String> normalizeAll(List<String> names) {
        if (names == null) {
            return Set.of();
        }
        return names.stream().map(KeyNames::normalize).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Compares a configured key plus modifiers with a reserved combination such as "META+TAB".
     */
    public static boolean matchesReserved(Set<String> mods, String key, String reserved) {
        if (reserved == null || reserved.isBlank()) {
            return false;
        }
        Set<String> rmods = new HashSet<>();
        String rkey = null;
        for (String part : reserved.split("\\+")) {
            String n = normalize(part);
            if (n.isEmpty()) {
                continue;
            }
            if (MODIFIERS.contains(n)) {
                rmods.add(n);
            } else {
                rkey = n;
            }
        }
        Set<String> cmods = mods.stream().map(KeyNames::normalize).collect(Collectors.toSet());
        return normalize(key).equals(rkey) && cmods.equals(rmods);
    }
}
