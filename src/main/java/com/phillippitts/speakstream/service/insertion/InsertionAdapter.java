package com.phillippitts.speakstream.service.insertion;

/** One strategy for delivering text to the focused application. */
interface InsertionAdapter {

    /** Position in the fallback chain; lower runs first. */
    int order();

    /** @return true if the adapter is usable in the current environment */
    boolean isAvailable();

    /** Delivers the text; returns true on success. */
    boolean insert(String text);

    /** Name for logs and events. */
    String name();
}
