package com.phillippitts.speakstream.domain;

import java.util.List;

/**
 * Best-effort description of the user's environment at the start of a dictation.
 *
 * <p>Any field may be empty when it could not be gathered; gathering never fails the session.
 *
 * @param windowTitle  title of the focused window, or empty
 * @param appName      name of the foreground application, or empty
 * @param selectedText selected text (only gathered in {@link DictationMode#EDIT}), or empty
 * @param vocabulary   user dictionary words
 * @param modelSettings model settings to apply for this session
 */
public record ContextSnapshot(
        String windowTitle,
        String appName,
        String selectedText,
        List<String> vocabulary,
        ModelSettings modelSettings
) {

    public ContextSnapshot {
        windowTitle = windowTitle == null ? "" : windowTitle;
        appName = appName == null ? "" : appName;
        selectedText = selectedText == null ? "" : selectedText;
        vocabulary = vocabulary == null ? List.of() : List.copyOf(vocabulary);
        modelSettings = modelSettings == null ? ModelSettings.empty() : modelSettings;
    }

    public static ContextSnapshot empty() {
        return new ContextSnapshot("", "", "", List.of(), ModelSettings.empty());
    }
}
