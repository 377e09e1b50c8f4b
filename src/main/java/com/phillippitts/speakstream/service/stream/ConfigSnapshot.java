package com.phillippitts.speakstream.service.stream;

import com.phillippitts.speakstream.domain.ContextSnapshot;
import com.phillippitts.speakstream.domain.DictationMode;
import com.phillippitts.speakstream.domain.ModelSettings;

import java.util.List;
import java.util.Objects;

/**
 * Full context and settings for the remote session, sent once per session after the
 * environment has been inspected.
 */
public record ConfigSnapshot(
        DictationMode mode,
        String windowTitle,
        String appName,
        String selectedText,
        List<String> vocabulary,
        ModelSettings modelSettings
) implements ControlMessage {

    public ConfigSnapshot {
        Objects.requireNonNull(mode, "mode must not be null");
        windowTitle = windowTitle == null ? "" : windowTitle;
        appName = appName == null ? "" : appName;
        selectedText = selectedText == null ? "" : selectedText;
        vocabulary = vocabulary == null ? List.of() : List.copyOf(vocabulary);
        modelSettings = modelSettings == null ? ModelSettings.empty() : modelSettings;
    }

    public static ConfigSnapshot of(DictationMode mode, ContextSnapshot context) {
        return new ConfigSnapshot(mode, context.windowTitle(), context.appName(), context.selectedText(),
                context.vocabulary(), context.modelSettings());
    }

    @Override
    public String toString() {
        // selectedText may contain user content
        return "ConfigSnapshot[mode=" + mode + ", appName=" + appName + ", selectedChars=" + selectedText.length()
                + ", vocabulary=" + vocabulary.size() + "]";
    }
}
