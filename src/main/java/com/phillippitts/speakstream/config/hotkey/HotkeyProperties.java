package com.phillippitts.speakstream.config.hotkey;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for the global dictation hotkeys.
 *
 * Holding {@code key} dictates in TRANSCRIBE mode, holding {@code edit-key} in EDIT mode.
 * With {@code toggle-mode} a press starts and the next press finishes.
 */
@Validated
@ConfigurationProperties(prefix = "hotkey")
public class HotkeyProperties {

    /** Dictation key (e.g., RIGHT_META, F13). */
    @NotBlank
    private final String key;

    /** Key that starts or switches to EDIT mode. */
    @NotBlank
    private final String editKey;

    /** Key that cancels the running session. */
    @NotBlank
    private final String cancelKey;

    /** Modifiers required with {@code key} and {@code edit-key}. */
    private final List<String> modifiers;

    /** Press-to-start, press-to-finish instead of push-to-talk. */
    private final boolean toggleMode;

    /** Reserved OS shortcuts to flag as conflicts (e.g., META+TAB, META+L). */
    private final List<String> reserved;

    @ConstructorBinding
    public HotkeyProperties(String key,
                            String editKey,
                            String cancelKey,
                            List<String> modifiers,
                            Boolean toggleMode,
                            List<String> reserved) {
        this.key = (key == null || key.isBlank()) ? "RIGHT_META" : key;
        this.editKey = (editKey == null || editKey.isBlank()) ? "RIGHT_ALT" : editKey;
        this.cancelKey = (cancelKey == null || cancelKey.isBlank()) ? "ESCAPE" : cancelKey;
        this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        this.toggleMode = toggleMode != null && toggleMode;
        this.reserved = (reserved == null || reserved.isEmpty())
                ? List.of("META+TAB", "META+L")
                : List.copyOf(reserved);
    }

    public String getKey() { return key; }
    public String getEditKey() { return editKey; }
    public String getCancelKey() { return cancelKey; }
    public List<String> getModifiers() { return modifiers; }
    public boolean isToggleMode() { return toggleMode; }
    public List<String> getReserved() { return reserved; }
}
