package kvserver.protocol;

import static org.junit.Assert.*;

import org.junit.Test;

public class ReplyTest {
    @Test
    public final void testSimple() {
        assertEquals("+PONG\r\n", Reply.PONG.toString());
        assertEquals("+OK\r\n", Reply.OK.toString());
        assertFalse(Reply.OK.isError());
    }

    @Test
    public final void testBulkIsLengthPrefixed() {
        final byte[] data = {'a', '\r', '\n', 0, (byte) 0xff};
        final byte[] encoded = Reply.bulk(data).toBytes();

        assertEquals("$5\r\n", new String(encoded, 0, 4,
                Command.BYTE_CHARSET));
        for (int i = 0; i < data.length; i++) {
            assertEquals(data[i], encoded[4 + i]);
        }
        assertEquals('\r', encoded[9]);
        assertEquals('\n', encoded[10]);
        assertEquals(11, encoded.length);
    }

    @Test
    public final void testNullAndError() {
        assertEquals("$-1\r\n", Reply.NULL_BULK.toString());
        final Reply error = Reply.error("bad\r\nthing");
        assertEquals("-ERR bad  thing\r\n", error.toString());
        assertTrue(error.isError());
    }

    @Test
    public final void testByteBufferIsReadOnlyView() {
        assertTrue(Reply.OK.toByteBuffer().isReadOnly());
        assertEquals(0, Reply.OK.toByteBuffer().position());
    }

    @Test(expected = IllegalArgumentException.class)
    public final void testSimpleRejectsLineBreak() {
        Reply.simple("a\r\nb");
    }
}
