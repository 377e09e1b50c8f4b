/**
 * The streaming session: control messages, the outbound merge of audio and control items, and
 * {@link com.phillippitts.speakstream.service.stream.StreamSessionController}, which owns the one
 * active session.
 */
package com.phillippitts.speakstream.service.stream;
