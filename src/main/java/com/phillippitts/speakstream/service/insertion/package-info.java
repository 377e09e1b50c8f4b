/**
 * Delivery of finished transcripts into the focused application through a fallback chain of
 * insertion strategies.
 */
package com.phillippitts.speakstream.service.insertion;
