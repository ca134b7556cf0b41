package kvserver.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes request frames of the form
 * <pre>
 * *&lt;N&gt;\r\n followed by N times $&lt;L&gt;\r\n&lt;L bytes&gt;\r\n
 * </pre>
 * from a buffer that may hold a partial frame, one or more complete frames,
 * or both. The decoder keeps no state between calls and can be shared.
 */
public final class RespDecoder {
    static final int MAX_ARRAY_LENGTH = 1024 * 1024;

    static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;

    private static final long NEED_MORE = -1L;

    /**
     * Decode the next command in the buffer.
     *
     * @param buffer bytes received so far, in read mode. On success its
     *          position is advanced past the consumed frame; otherwise it
     *          is left untouched.
     * @param endOfStream true if no more bytes will ever arrive; a partial
     *          frame is then reported as truncated.
     * @return the command, or null if the buffer ends before the frame does.
     */
    public Command decode(final ByteBuffer buffer, final boolean endOfStream)
            throws ProtocolException {
        final int start = buffer.position();
        Command command;
        try {
            command = tryDecode(buffer);
        } catch (ProtocolException e) {
            buffer.position(start);
            throw e;
        }
        if (command == null) {
            buffer.position(start);
            if (endOfStream && buffer.hasRemaining()) {
                throw new ProtocolException(ProtocolException.PROTOCOL_ERROR,
                        "stream ended inside a frame, " + buffer.remaining()
                        + " bytes unconsumed");
            }
        }
        return command;
    }

    private static Command tryDecode(final ByteBuffer buffer)
            throws ProtocolException {
        final long count = readLength(buffer, (byte) '*', MAX_ARRAY_LENGTH);
        if (count == NEED_MORE) {
            return null;
        }
        final List<byte[]> elements = new ArrayList<>((int) Math.min(count,
                16));
        for (long i = 0; i < count; i++) {
            final byte[] element = readBulk(buffer);
            if (element == null) {
                return null;
            }
            elements.add(element);
        }
        return new Command(elements);
    }

    private static byte[] readBulk(final ByteBuffer buffer)
            throws ProtocolException {
        final long length = readLength(buffer, (byte) '$', MAX_BULK_LENGTH);
        if (length == NEED_MORE) {
            return null;
        }
        if (buffer.remaining() < length + 2) {
            return null;
        }
        final byte[] data = new byte[(int) length];
        buffer.get(data);
        if (buffer.get() != '\r' || buffer.get() != '\n') {
            throw new ProtocolException(ProtocolException.PROTOCOL_ERROR,
                    "bulk payload of " + length + " bytes not followed by CRLF");
        }
        return data;
    }

    /**
     * Read a marker byte, a decimal length of any number of digits and the
     * terminating CRLF.
     */
    private static long readLength(final ByteBuffer buffer, final byte marker,
            final long max) throws ProtocolException {
        if (!buffer.hasRemaining()) {
            return NEED_MORE;
        }
        final byte first = buffer.get();
        if (first != marker) {
            throw new ProtocolException(
                    ProtocolException.UNSUPPORTED_DATA_TYPE,
                    "expected '" + (char) marker + "' but got "
                    + describe(first));
        }

        long value = 0;
        int digits = 0;
        while (true) {
            if (!buffer.hasRemaining()) {
                return NEED_MORE;
            }
            final byte b = buffer.get();
            if (b == '\r') {
                break;
            }
            if (b < '0' || b > '9') {
                throw new ProtocolException(ProtocolException.PROTOCOL_ERROR,
                        "expected digit in length after '" + (char) marker
                        + "' but got " + describe(b));
            }
            value = value * 10 + (b - '0');
            digits++;
            // Checked per digit so the accumulator can never overflow.
            if (value > max) {
                throw new ProtocolException(ProtocolException.PROTOCOL_ERROR,
                        "length after '" + (char) marker + "' exceeds "
                        + max);
            }
        }
        if (digits == 0) {
            throw new ProtocolException(ProtocolException.PROTOCOL_ERROR,
                    "missing length after '" + (char) marker + "'");
        }
        if (!buffer.hasRemaining()) {
            return NEED_MORE;
        }
        final byte lf = buffer.get();
        if (lf != '\n') {
            throw new ProtocolException(ProtocolException.PROTOCOL_ERROR,
                    "expected LF after length but got " + describe(lf));
        }
        return value;
    }

    private static String describe(final byte b) {
        if (b >= 0x21 && b <= 0x7e) {
            return "'" + (char) b + "'";
        }
        return String.format("0x%02x", b & 0xff);
    }
}
