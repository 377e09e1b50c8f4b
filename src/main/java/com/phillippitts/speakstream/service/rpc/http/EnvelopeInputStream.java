package com.phillippitts.speakstream.service.rpc.http;

import com.phillippitts.speakstream.service.rpc.CancellationSignal;
import com.phillippitts.speakstream.service.stream.StreamRequest;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Objects;

/**
 * Request body that pulls outbound items lazily and encodes each one as an envelope.
 *
 * <p>Reads block while the outbound sequence waits for audio. Once the cancellation signal fires
 * every read fails so the HTTP client abandons the upload.
 */
final class EnvelopeInputStream extends InputStream {

    private final Iterator<StreamRequest> requests;
    private final CancellationSignal cancellation;
    private byte[] current = new byte[0];
    private int position;
    private boolean closed;
    private long envelopesSent;

    EnvelopeInputStream(Iterator<StreamRequest> requests, CancellationSignal cancellation) {
        this.requests = Objects.requireNonNull(requests, "requests must not be null");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
    }

    @Override
    public int read() throws IOException {
        if (!fill()) {
            return -1;
        }
        return current[position++] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        if (!fill()) {
            return -1;
        }
        int n = Math.min(len, current.length - position);
        System.arraycopy(current, position, b, off, n);
        position += n;
        return n;
    }

    private boolean fill() throws IOException {
        checkOpen();
        if (position < current.length) {
            return true;
        }
        if (!requests.hasNext()) {
            return false;
        }
        checkOpen();
        current = EnvelopeCodec.encode(requests.next());
        position = 0;
        envelopesSent++;
        return true;
    }

    private void checkOpen() throws IOException {
        if (cancellation.isCancelled()) {
            throw new IOException("Stream cancelled after " + envelopesSent + " envelopes");
        }
        if (closed) {
            throw new IOException("Stream closed");
        }
    }

    long envelopesSent() {
        return envelopesSent;
    }

    @Override
    public void close() {
        closed = true;
    }
}
