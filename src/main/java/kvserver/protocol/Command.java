package kvserver.protocol;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import com.google.common.base.Preconditions;

/**
 * A decoded request: element 0 is the command name, the rest are its
 * arguments. Elements are raw bytes exactly as sent by the client.
 */
public final class Command {
    /**
     * Maps every byte to exactly one char and back, so strings built with
     * it compare like the underlying bytes.
     */
    public static final Charset BYTE_CHARSET = StandardCharsets.ISO_8859_1;

    private final byte[][] elements;

    Command(final List<byte[]> elements) {
        this.elements = elements.toArray(new byte[0][]);
    }

    public static Command of(final byte[]... elements) {
        final byte[][] copy = new byte[elements.length][];
        for (int i = 0; i < elements.length; i++) {
            copy[i] = Arrays.copyOf(elements[i], elements[i].length);
        }
        return new Command(Arrays.asList(copy));
    }

    public static Command of(final String... elements) {
        final byte[][] bytes = new byte[elements.length][];
        for (int i = 0; i < elements.length; i++) {
            bytes[i] = elements[i].getBytes(BYTE_CHARSET);
        }
        return new Command(Arrays.asList(bytes));
    }

    public boolean isEmpty() {
        return elements.length == 0;
    }

    /** Element count, including the command name. */
    public int size() {
        return elements.length;
    }

    /** Command name folded to upper case for case-insensitive matching. */
    public String getName() {
        Preconditions.checkState(!isEmpty(), "empty command has no name");
        return new String(elements[0], BYTE_CHARSET).toUpperCase(Locale.ROOT);
    }

    /** Copy of the element at index; index 0 is the name. */
    public byte[] getElement(final int index) {
        Preconditions.checkElementIndex(index, elements.length);
        return Arrays.copyOf(elements[index], elements[index].length);
    }

    public String getElementAsString(final int index) {
        Preconditions.checkElementIndex(index, elements.length);
        return new String(elements[index], BYTE_CHARSET);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("Command[");
        for (int i = 0; i < elements.length; i++) {
            if (i != 0) {
                sb.append(' ');
            }
            if (i == 0 || elements[i].length <= 32) {
                sb.append(new String(elements[i], BYTE_CHARSET));
            } else {
                sb.append('<').append(elements[i].length).append(" bytes>");
            }
        }
        return sb.append(']').toString();
    }
}
