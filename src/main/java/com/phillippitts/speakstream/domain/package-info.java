/**
 * Immutable value types shared across the dictation pipeline: audio frames,
 * context snapshots, transcript results and the records exchanged with the
 * remote transcription service.
 */
package com.phillippitts.speakstream.domain;
