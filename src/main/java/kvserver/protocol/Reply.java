package kvserver.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * Encoded response frame. Formats:
 * <pre>
 * +&lt;text&gt;\r\n
 * $&lt;length&gt;\r\n&lt;bytes&gt;\r\n
 * $-1\r\n
 * -ERR &lt;message&gt;\r\n
 * </pre>
 */
public final class Reply {
    private static final byte[] CRLF = {'\r', '\n'};

    public static final Reply OK = simple("OK");

    public static final Reply PONG = simple("PONG");

    public static final Reply NULL_BULK = new Reply(
            "$-1\r\n".getBytes(Command.BYTE_CHARSET));

    private final byte[] encoded;

    private Reply(final byte[] encoded) {
        this.encoded = encoded;
    }

    public static Reply simple(final String status) {
        Preconditions.checkArgument(status.indexOf('\r') < 0
                && status.indexOf('\n') < 0,
                "status cannot contain CR or LF: %s", status);
        return new Reply(("+" + status + "\r\n").getBytes(
                Command.BYTE_CHARSET));
    }

    public static Reply bulk(final byte[] data) {
        Preconditions.checkNotNull(data);

        final byte[] header = ("$" + data.length + "\r\n").getBytes(
                Command.BYTE_CHARSET);
        final ByteArrayOutputStream out = new ByteArrayOutputStream(
                header.length + data.length + CRLF.length);
        out.write(header, 0, header.length);
        out.write(data, 0, data.length);
        out.write(CRLF, 0, CRLF.length);
        return new Reply(out.toByteArray());
    }

    /** Error reply; line breaks in the message are flattened to spaces. */
    public static Reply error(final String message) {
        final String line = message.replace('\r', ' ').replace('\n', ' ');
        return new Reply(("-ERR " + line + "\r\n").getBytes(
                Command.BYTE_CHARSET));
    }

    public boolean isError() {
        return encoded[0] == '-';
    }

    /** Read-only view of the encoded frame, positioned at 0. */
    public ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(encoded).asReadOnlyBuffer();
    }

    public byte[] toBytes() {
        return Arrays.copyOf(encoded, encoded.length);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Arrays.equals(encoded, ((Reply) obj).encoded);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(encoded);
    }

    @Override
    public String toString() {
        return new String(encoded, Command.BYTE_CHARSET);
    }
}
