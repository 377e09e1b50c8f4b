package com.phillippitts.speakstream.service.stream;

/**
 * Out-of-band update spliced into the outbound stream ahead of the next audio frame.
 *
 * <p>Implementations are {@link ModeUpdate} (partial update of the mode only) and
 * {@link ConfigSnapshot} (full context and settings).
 */
public interface ControlMessage {
}
