package com.phillippitts.speakstream.service.insertion;

import com.phillippitts.speakstream.config.typing.TypingProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Tier 1: puts the text on the clipboard, sends the paste shortcut, then restores the previous
 * clipboard contents. Requires the Accessibility permission on macOS.
 */
@Component
class PasteShortcutAdapter implements InsertionAdapter {

    private static final Logger LOG = LogManager.getLogger(PasteShortcutAdapter.class);

    private final TypingProperties props;
    private final ClipboardAccess clipboard;
    private final KeyboardDriver keys;

    @Autowired
    PasteShortcutAdapter(TypingProperties props) {
        this(props, ClipboardAccess.system(), createKeyboard());
    }

    PasteShortcutAdapter(TypingProperties props, ClipboardAccess clipboard, KeyboardDriver keys) {
        this.props = Objects.requireNonNull(props);
        this.clipboard = Objects.requireNonNull(clipboard);
        this.keys = keys; // null when no display is available
    }

    private static KeyboardDriver createKeyboard() {
        try {
            return KeyboardDriver.robot();
        } catch (Exception | LinkageError e) {
            LOG.info("Keyboard automation unavailable: {}", e.toString());
            return null;
        }
    }

    @Override
    public int order() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return props.isEnableRobot() && keys != null;
    }

    @Override
    public boolean insert(String text) {
        Optional<String> prior = props.isRestoreClipboard() ? clipboard.readText() : Optional.empty();
        clipboard.writeText(text);
        if (props.getFocusDelayMs() > 0) {
            keys.delay(props.getFocusDelayMs());
        }
        KeyboardDriver.sendPaste(keys, props.getPasteShortcut());
        if (prior.isPresent()) {
            // the target app reads the clipboard asynchronously after the shortcut
            keys.delay(props.getRestoreDelayMs());
            clipboard.writeText(prior.get());
        }
        return true;
    }

    @Override
    public String name() {
        return "paste";
    }
}
