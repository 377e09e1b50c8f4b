/**
 * Global hotkeys: the native hook seam, key normalization and the mapping from key presses to
 * dictation sessions.
 */
package com.phillippitts.speakstream.service.hotkey;
