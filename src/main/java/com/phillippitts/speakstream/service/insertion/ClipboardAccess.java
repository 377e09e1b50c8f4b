package com.phillippitts.speakstream.service.insertion;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.io.IOException;
import java.util.Optional;

/**
 * Text access to the system clipboard; replaced by a fake in tests.
 */
interface ClipboardAccess {

    Optional<String> readText();

    void writeText(String text);

    static ClipboardAccess system() {
        return new ClipboardAccess() {
            private final Logger log = LogManager.getLogger(ClipboardAccess.class);

            @Override
            public Optional<String> readText() {
                Clipboard cb = Toolkit.getDefaultToolkit().getSystemClipboard();
                try {
                    if (cb.isDataFlavorAvailable(DataFlavor.stringFlavor)) {
                        return Optional.of((String) cb.getData(DataFlavor.stringFlavor));
                    }
                } catch (UnsupportedFlavorException | IOException | IllegalStateException e) {
                    log.debug("Could not read clipboard: {}", e.toString());
                }
                return Optional.empty();
            }

            @Override
            public void writeText(String text) {
                Toolkit.getDefaultToolkit().getSystemClipboard().setContents(new StringSelection(text), null);
            }
        };
    }
}
