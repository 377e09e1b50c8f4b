package com.phillippitts.speakstream.testutil;

import com.phillippitts.speakstream.domain.ContextSnapshot;
import com.phillippitts.speakstream.domain.DictationMode;
import com.phillippitts.speakstream.domain.ModelSettings;
import com.phillippitts.speakstream.service.context.ContextProvider;

import java.util.List;

/**
 * Returns a fixed context; {@link #cursorContext} feeds the grammar rules.
 */
public class FakeContextProvider implements ContextProvider {
    public volatile String cursorContext = "";
    public volatile RuntimeException failure;

    @Override
    public ContextSnapshot gatherContext(DictationMode mode) {
        if (failure != null) {
            throw failure;
        }
        return new ContextSnapshot("Draft", "Notes", mode == DictationMode.EDIT ? "selected" : "",
                List.of("Kubernetes"), ModelSettings.empty());
    }

    @Override
    public String getCursorContext(int maxChars) {
        String ctx = cursorContext;
        return ctx.length() <= maxChars ? ctx : ctx.substring(ctx.length() - maxChars);
    }
}
