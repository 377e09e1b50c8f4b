package com.phillippitts.speakstream.service.rpc.auth;

import java.time.Instant;

/**
 * Published when credentials could not be refreshed and the application must sign the user out.
 */
public record AuthInvalidatedEvent(String reason, Instant at) { }
