package io.aiorg.transport.socket;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * Length-prefixed framing: a 4-byte big-endian unsigned length followed by that many bytes of
 * UTF-8 JSON.
 */
public final class FrameCodec {
    public static final int HEADER_BYTES = 4;

    private FrameCodec() {
    }

    public static byte[] read(InputStream in, int maxBytes) throws IOException {
        byte[] header = new byte[HEADER_BYTES];
        int first = in.read();
        if (first < 0) {
            return null;
        }
        header[0] = (byte) first;
        readFully(in, header, 1, HEADER_BYTES - 1);
        long length = ByteBuffer.wrap(header).getInt() & 0xFFFFFFFFL;
        if (length > maxBytes) {
            throw new FrameTooLargeException(length, maxBytes);
        }
        byte[] body = new byte[(int) length];
        readFully(in, body, 0, body.length);
        return body;
    }

    public static void write(OutputStream out, byte[] body) throws IOException {
        out.write(encode(body));
        out.flush();
    }

    // Header and body as one buffer, so a frame goes out in a single write.
    public static byte[] encode(byte[] body) {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_BYTES + body.length);
        buf.putInt(body.length);
        buf.put(body);
        return buf.array();
    }

    private static void readFully(InputStream in, byte[] buf, int offset, int len) throws IOException {
        int done = 0;
        while (done < len) {
            int n = in.read(buf, offset + done, len - done);
            if (n < 0) {
                throw new EOFException("Truncated frame: expected " + len + " bytes, got " + done);
            }
            done += n;
        }
    }
}
