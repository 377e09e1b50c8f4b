package com.phillippitts.speakstream.service.context;

import com.phillippitts.speakstream.domain.ContextSnapshot;
import com.phillippitts.speakstream.domain.DictationMode;

/**
 * Best-effort source of environment context for a dictation session.
 *
 * <p>Implementations never throw for missing information: any field that cannot be gathered is
 * returned empty.
 */
public interface ContextProvider {

    /**
     * Gathers window, selection, vocabulary and model settings for a session in {@code mode}.
     * Selected text is only gathered in {@link DictationMode#EDIT}.
     */
    ContextSnapshot gatherContext(DictationMode mode);

    /**
     * Returns up to {@code maxChars} characters immediately before the caret in the focused
     * text field, or "" when unavailable.
     */
    String getCursorContext(int maxChars);
}
