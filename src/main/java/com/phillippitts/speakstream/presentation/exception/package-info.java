/**
 * Mapping of exceptions to HTTP error responses.
 */
package com.phillippitts.speakstream.presentation.exception;
