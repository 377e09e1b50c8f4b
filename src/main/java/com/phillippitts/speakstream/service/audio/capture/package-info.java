/**
 * Microphone capture delivering PCM frames to the streaming session.
 */
package com.phillippitts.speakstream.service.audio.capture;
