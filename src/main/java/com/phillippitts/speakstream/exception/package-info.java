/**
 * Unchecked exception hierarchy rooted at {@link com.phillippitts.speakstream.exception.SpeakStreamException}.
 *
 * <p>Remote failures surface as {@link com.phillippitts.speakstream.exception.RpcException} with an
 * {@link com.phillippitts.speakstream.exception.RpcStatus}; local cancellation as
 * {@link com.phillippitts.speakstream.exception.StreamCancelledException}.
 */
package com.phillippitts.speakstream.exception;
