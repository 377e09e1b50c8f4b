package com.phillippitts.speakstream.service.insertion.event;

import java.time.Instant;

/** Published when no insertion tier succeeded. */
public record AllInsertionFallbacksFailedEvent(String reason, Instant at) { }
