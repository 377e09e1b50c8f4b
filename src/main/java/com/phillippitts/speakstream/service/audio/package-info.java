/**
 * PCM format constants and the buffer that feeds captured audio into the outbound stream.
 */
package com.phillippitts.speakstream.service.audio;
