package com.phillippitts.speakstream.service.context;

/**
 * OS-specific inspection of the focused application.
 *
 * <p>Methods may block briefly and may throw on failure; callers treat every failure as
 * "not available".
 */
public interface ForegroundAppInspector {

    ForegroundWindow activeWindow();

    /** Currently selected text in the focused element, "" when nothing is selected. */
    String selectedText();

    /** Up to {@code maxChars} characters before the caret, "" when unavailable. */
    String textBeforeCursor(int maxChars);

    /**
     * Inspector for platforms without support; reports nothing.
     */
    static ForegroundAppInspector unavailable() {
        return new ForegroundAppInspector() {
            @Override
            public ForegroundWindow activeWindow() {
                return ForegroundWindow.UNKNOWN;
            }

            @Override
            public String selectedText() {
                return "";
            }

            @Override
            public String textBeforeCursor(int maxChars) {
                return "";
            }
        };
    }
}
