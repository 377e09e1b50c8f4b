/**
 * Remote transcription service client seam, cancellation, and the authentication retry policy
 * that wraps every remote call.
 */
package com.phillippitts.speakstream.service.rpc;
