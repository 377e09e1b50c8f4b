package com.phillippitts.speakstream.config.typing;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties controlling how transcripts are inserted into the focused application.
 *
 * Privacy defaults: clipboard restore enabled; INFO logs never include text.
 */
@Validated
@ConfigurationProperties(prefix = "typing")
public class TypingProperties {

    /** Delay before sending the paste shortcut, letting focus settle after the hotkey release. */
    @Min(0)
    @Max(1000)
    private final int focusDelayMs;

    /** Delay after pasting before the prior clipboard contents are restored. */
    @Min(0)
    @Max(2000)
    private final int restoreDelayMs;

    /** Whether to restore prior clipboard contents after paste. */
    private final boolean restoreClipboard;

    /** Enable Robot-driven paste (tier 1). If false, the text is only placed on the clipboard. */
    private final boolean enableRobot;

    /** Paste shortcut: os-default | META+V | CONTROL+V. */
    @Pattern(regexp = "(?i)os-default|META\\+V|CONTROL\\+V")
    private final String pasteShortcut;

    @ConstructorBinding
    public TypingProperties(Integer focusDelayMs,
                            Integer restoreDelayMs,
                            Boolean restoreClipboard,
                            Boolean enableRobot,
                            String pasteShortcut) {
        this.focusDelayMs = focusDelayMs == null ? 50 : focusDelayMs;
        this.restoreDelayMs = restoreDelayMs == null ? 250 : restoreDelayMs;
        this.restoreClipboard = restoreClipboard == null ? true : restoreClipboard;
        this.enableRobot = enableRobot == null ? true : enableRobot;
        this.pasteShortcut = (pasteShortcut == null || pasteShortcut.isBlank()) ? "os-default" : pasteShortcut;
    }

    public int getFocusDelayMs() { return focusDelayMs; }
    public int getRestoreDelayMs() { return restoreDelayMs; }
    public boolean isRestoreClipboard() { return restoreClipboard; }
    public boolean isEnableRobot() { return enableRobot; }
    public String getPasteShortcut() { return pasteShortcut; }
}
