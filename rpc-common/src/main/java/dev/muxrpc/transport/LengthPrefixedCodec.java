package dev.muxrpc.transport;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Frames text messages for stream sockets: a four-byte big-endian payload length followed by the
 * UTF-8 encoded text.
 */
public final class LengthPrefixedCodec {

    public static final int DEFAULT_MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private static final int HEADER_LENGTH = 4;

    private LengthPrefixedCodec() {
    }

    public static void writeFrame(OutputStream out, String text, int maxFrameLength) throws IOException {
        byte[] payload = text.getBytes(StandardCharsets.UTF_8);
        if (payload.length > maxFrameLength) {
            throw new IOException("Frame of " + payload.length + " bytes exceeds limit of " + maxFrameLength);
        }
        byte[] header = ByteBuffer.allocate(HEADER_LENGTH).order(ByteOrder.BIG_ENDIAN).putInt(payload.length).array();
        out.write(header);
        out.write(payload);
        out.flush();
    }

    /**
     * Reads the next frame.
     *
     * @return the frame text, or {@code null} when the stream ended cleanly between frames
     */
    public static String readFrame(InputStream in, int maxFrameLength) throws IOException {
        DataInputStream data = in instanceof DataInputStream dataInput ? dataInput : new DataInputStream(in);
        int first = data.read();
        if (first == -1) {
            return null;
        }
        byte[] rest = new byte[HEADER_LENGTH - 1];
        try {
            data.readFully(rest);
        } catch (EOFException e) {
            throw new EOFException("Stream closed inside a frame header");
        }
        int length = ByteBuffer.wrap(new byte[] {(byte) first, rest[0], rest[1], rest[2]})
            .order(ByteOrder.BIG_ENDIAN)
            .getInt();
        if (length < 0 || length > maxFrameLength) {
            throw new IOException("Invalid frame length: " + length);
        }
        byte[] payload = new byte[length];
        try {
            data.readFully(payload);
        } catch (EOFException e) {
            throw new EOFException("Stream closed while reading frame payload of length " + length);
        }
        return new String(payload, StandardCharsets.UTF_8);
    }
}
