package com.auraide.sandbox.local;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Collects process output up to a byte limit, discarding and flagging the rest.
 */
class BoundedOutputStream extends OutputStream {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final int limit;
    private boolean overflowed;

    BoundedOutputStream(int limit) {
        this.limit = limit;
    }

    @Override
    public synchronized void write(int b) {
        if (buffer.size() < limit) {
            buffer.write(b);
        } else {
            overflowed = true;
        }
    }

    @Override
    public synchronized void write(byte[] b, int off, int len) {
        int room = limit - buffer.size();
        if (len > room) {
            overflowed = true;
        }
        int accepted = Math.max(0, Math.min(room, len));
        if (accepted > 0) {
            buffer.write(b, off, accepted);
        }
    }

    synchronized boolean overflowed() {
        return overflowed;
    }

    synchronized String text() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
