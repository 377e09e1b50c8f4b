package com.phillippitts.speakstream.service.insertion;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.awt.GraphicsEnvironment;
import java.util.Objects;

/** Tier 2: leaves the text on the clipboard for the user to paste manually. */
@Component
class ClipboardOnlyAdapter implements InsertionAdapter {

    private static final Logger LOG = LogManager.getLogger(ClipboardOnlyAdapter.class);

    private final ClipboardAccess clipboard;
    private final boolean available;

    @Autowired
    ClipboardOnlyAdapter() {
        this(ClipboardAccess.system(), !GraphicsEnvironment.isHeadless());
    }

    ClipboardOnlyAdapter(ClipboardAccess clipboard, boolean available) {
        this.clipboard = Objects.requireNonNull(clipboard);
        this.available = available;
    }

    @Override
    public int order() {
        return 20;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public boolean insert(String text) {
        clipboard.writeText(text);
        LOG.info("Transcript placed on clipboard (chars={}); paste manually", text.length());
        return true;
    }

    @Override
    public String name() {
        return "clipboard";
    }
}
