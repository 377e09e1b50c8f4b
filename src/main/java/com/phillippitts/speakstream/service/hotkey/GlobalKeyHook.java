package com.phillippitts.speakstream.service.hotkey;

import java.util.function.Consumer;

/**
 * Global keyboard hook delivering {@link NormalizedKeyEvent}s; replaced by a fake in tests.
 */
public interface GlobalKeyHook {

    /**
     * Installs the hook. Idempotent.
     *
     * @throws SecurityException if the OS denies input monitoring
     */
    void register();

    /** Removes the hook. Idempotent. */
    void unregister();

    /** Sets the single listener for key events. */
    void addListener(Consumer<NormalizedKeyEvent> listener);
}
