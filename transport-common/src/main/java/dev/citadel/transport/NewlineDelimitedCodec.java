package dev.citadel.transport;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Codec that writes and reads frames made of one line of UTF-8 encoded JSON text terminated
 * by {@code '\n'}. A trailing {@code '\r'} is tolerated and blank lines are skipped.
 */
public final class NewlineDelimitedCodec {

    public static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private NewlineDelimitedCodec() {
    }

    public static void writeFrame(OutputStream out, String json) throws IOException {
        out.write(frameBytes(json));
        out.flush();
    }

    public static byte[] frameBytes(String json) throws IOException {
        if (json.indexOf('\n') >= 0) {
            throw new IOException("Frame contains a raw newline");
        }
        byte[] payload = json.getBytes(StandardCharsets.UTF_8);
        if (payload.length > MAX_FRAME_BYTES) {
            throw new IOException("Frame too large: " + payload.length);
        }
        byte[] frame = new byte[payload.length + 1];
        System.arraycopy(payload, 0, frame, 0, payload.length);
        frame[payload.length] = '\n';
        return frame;
    }

    /**
     * Reads the next non-blank line. Callers should pass a buffered stream.
     *
     * @return the frame without its terminator, or {@code null} on a clean end of stream
     */
    public static String readFrame(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(256);
        while (true) {
            int b = in.read();
            if (b == -1) {
                if (isBlank(buffer)) {
                    return null; // EOF between frames indicates clean shutdown.
                }
                throw new EOFException("Stream closed inside a frame after " + buffer.size() + " bytes");
            }
            if (b == '\n') {
                if (isBlank(buffer)) {
                    buffer.reset();
                    continue;
                }
                return stripCarriageReturn(buffer.toString(StandardCharsets.UTF_8));
            }
            if (buffer.size() >= MAX_FRAME_BYTES) {
                throw new IOException("Frame exceeds " + MAX_FRAME_BYTES + " bytes");
            }
            buffer.write(b);
        }
    }

    private static boolean isBlank(ByteArrayOutputStream buffer) {
        return buffer.size() == 0 || buffer.toString(StandardCharsets.UTF_8).isBlank();
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
