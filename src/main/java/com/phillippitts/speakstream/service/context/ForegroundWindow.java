package com.phillippitts.speakstream.service.context;

/**
 * Identity of the focused application window.
 */
public record ForegroundWindow(String appName, String windowTitle) {

    public static final ForegroundWindow UNKNOWN = new ForegroundWindow("", "");

    public ForegroundWindow {
        appName = appName == null ? "" : appName;
        windowTitle = windowTitle == null ? "" : windowTitle;
    }
}
