/**
 * HTTP transport for the transcription service: length-prefixed JSON envelopes for the streaming
 * call, plain JSON for unary calls.
 */
package com.phillippitts.speakstream.service.rpc.http;
