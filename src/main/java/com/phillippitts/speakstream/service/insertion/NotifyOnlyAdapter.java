package com.phillippitts.speakstream.service.insertion;

import com.phillippitts.speakstream.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/** Tier 3: log-only notification (no OS interactions). */
@Component
class NotifyOnlyAdapter implements InsertionAdapter {

    private static final Logger LOG = LogManager.getLogger(NotifyOnlyAdapter.class);

    @Override
    public int order() {
        return 100;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public boolean insert(String text) {
        LOG.info("Transcript ready (chars={})", text.length());
        LOG.debug("Preview: '{}'", LogSanitizer.truncate(text, 120));
        return true; // counts as delivered so the chain does not report a failure
    }

    @Override
    public String name() {
        return "notify";
    }
}
