/**
 * Environment context for dictation sessions: focused window, selection, caret text,
 * user vocabulary and model settings.
 */
package com.phillippitts.speakstream.service.context;
