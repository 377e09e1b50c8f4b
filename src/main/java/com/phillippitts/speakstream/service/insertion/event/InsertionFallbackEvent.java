package com.phillippitts.speakstream.service.insertion.event;

import java.time.Instant;

/** Published when an insertion tier fails and the next tier is attempted. */
public record InsertionFallbackEvent(String tier, String reason, Instant at) { }
