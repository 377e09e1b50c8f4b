package com.phillippitts.speakstream.service.insertion;

/**
 * Delivers a finished transcript into the focused application.
 */
public interface TextInsertionSink {

    /**
     * Inserts {@code text} at the caret of the focused application. Blank text is never inserted.
     * Implementations must not log the text at INFO.
     *
     * @return true if the text was delivered by any strategy
     */
    boolean insertText(String text);
}
