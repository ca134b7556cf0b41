package kvserver.protocol;

/**
 * Raised when a request frame violates the array/bulk-string grammar. The
 * stream cannot be parsed past this point, so the connection has to be
 * dropped after {@link #getReplyMessage()} is reported to the client.
 */
public final class ProtocolException extends Exception {
    private static final long serialVersionUID = 4376113205563312784L;

    static final String UNSUPPORTED_DATA_TYPE = "unsupported data type";

    static final String PROTOCOL_ERROR = "protocol error";

    private final String replyMessage;

    ProtocolException(final String replyMessage, final String detail) {
        super(replyMessage + ": " + detail);
        this.replyMessage = replyMessage;
    }

    /** Message sent to the client as {@code -ERR <message>}. */
    public String getReplyMessage() {
        return replyMessage;
    }
}
