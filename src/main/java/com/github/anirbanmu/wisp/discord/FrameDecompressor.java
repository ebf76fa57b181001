package com.github.anirbanmu.wisp.discord;

import com.github.anirbanmu.wisp.log.Log;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

// zlib-stream reassembly. one inflater spans every message of a connection, so it must be
// replaced (reset) whenever a new connection starts. not thread safe; owned by one gateway.
public class FrameDecompressor {
    private static final byte[] ZLIB_SUFFIX = {0x00, 0x00, (byte) 0xFF, (byte) 0xFF};
    private static final int CHUNK = 8192;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final AtomicLong dropped = new AtomicLong();
    private Inflater inflater = new Inflater();

    // text frames are uncompressed; a text frame in the middle of a binary message drops the partial bytes
    public String feedText(CharSequence text) {
        if (buffer.size() > 0) {
            Log.warn("gateway.partial_frame_discarded", "bytes", buffer.size());
            buffer.reset();
        }
        return text.toString();
    }

    // null until the accumulated bytes end with the flush marker
    public String feedBinary(byte[] frame) {
        buffer.write(frame, 0, frame.length);
        if (!endsWithSuffix(frame)) {
            return null;
        }

        byte[] compressed = buffer.toByteArray();
        buffer.reset();

        try {
            return inflate(compressed);
        } catch (DataFormatException e) {
            long total = dropped.incrementAndGet();
            Log.warn("gateway.frame_dropped", e, "bytes", compressed.length, "dropped_total", total);
            return null;
        }
    }

    public int bufferedBytes() {
        return buffer.size();
    }

    public long droppedMessages() {
        return dropped.get();
    }

    public void reset() {
        buffer.reset();
        inflater.end();
        inflater = new Inflater();
    }

    private String inflate(byte[] compressed) throws DataFormatException {
        inflater.setInput(compressed);
        ByteArrayOutputStream out = new ByteArrayOutputStream(compressed.length * 4);
        byte[] chunk = new byte[CHUNK];
        // keep pulling until the inflater stops producing; it may hold output after consuming all input
        int n;
        do {
            n = inflater.inflate(chunk);
            out.write(chunk, 0, n);
        } while (n > 0);
        return out.toString(StandardCharsets.UTF_8);
    }

    // the marker is almost always inside the last frame; only tiny frames need the buffer
    private boolean endsWithSuffix(byte[] frame) {
        byte[] tail = frame;
        if (frame.length < ZLIB_SUFFIX.length) {
            if (buffer.size() < ZLIB_SUFFIX.length) {
                return false;
            }
            tail = buffer.toByteArray();
        }
        int offset = tail.length - ZLIB_SUFFIX.length;
        for (int i = 0; i < ZLIB_SUFFIX.length; i++) {
            if (tail[offset + i] != ZLIB_SUFFIX[i]) {
                return false;
            }
        }
        return true;
    }
}
