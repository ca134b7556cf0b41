package kvserver.commands;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import kvserver.protocol.Command;
import kvserver.protocol.ProtocolException;
import kvserver.protocol.Reply;
import kvserver.protocol.RespDecoder;

/**
 * Serves one client connection on a blocking channel until the client
 * disconnects. Bytes are accumulated in a private buffer; every complete
 * command in it is dispatched and its reply written out before the next
 * command is decoded, so pipelined requests are answered in order.
 * A malformed frame is answered with an error and the connection is closed,
 * as the stream cannot be resynchronised. Failures here never reach the
 * store or any other connection.
 */
public final class ConnectionHandler implements Runnable {
    private static final Logger LOGGER = LogManager.getLogger(
            ConnectionHandler.class);

    static final int INITIAL_BUFFER_SIZE = 4096;

    private static final Reply INTERNAL_ERROR = Reply.error("internal error");

    private final SocketChannel socketChannel;

    private final RespDecoder decoder;

    private final CommandDispatcher dispatcher;

    /** Invoked once the channel is closed. */
    private final Runnable onClose;

    private ByteBuffer readBuffer = ByteBuffer.allocate(INITIAL_BUFFER_SIZE);

    private boolean endOfStream;

    public ConnectionHandler(final SocketChannel socketChannel,
            final RespDecoder decoder, final CommandDispatcher dispatcher,
            final Runnable onClose) {
        assert (socketChannel.isBlocking());

        this.socketChannel = socketChannel;
        this.decoder = decoder;
        this.dispatcher = dispatcher;
        this.onClose = onClose;
    }

    @Override
    public void run() {
        final String peer = describePeer();
        LOGGER.debug("Serving client " + peer);
        try {
            serve();
        } catch (ProtocolException e) {
            if (endOfStream) {
                LOGGER.warn("Client " + peer + " disconnected mid-request: "
                        + e.getMessage());
            } else {
                LOGGER.warn("Closing client " + peer
                        + " after malformed request: " + e.getMessage());
                writeBeforeClose(Reply.error(e.getReplyMessage()));
            }
        } catch (IOException e) {
            LOGGER.debug("I/O failure on client " + peer + ": "
                    + e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected failure serving client " + peer, e);
            writeBeforeClose(INTERNAL_ERROR);
        } finally {
            close();
            onClose.run();
            LOGGER.debug("Connection closed: " + peer);
        }
    }

    private void serve() throws IOException, ProtocolException {
        while (!endOfStream) {
            if (!readBuffer.hasRemaining()) {
                growReadBuffer();
            }
            endOfStream = socketChannel.read(readBuffer) == -1;

            readBuffer.flip();
            Command command;
            while ((command = decoder.decode(readBuffer, endOfStream))
                    != null) {
                // An empty array carries no command and gets no reply.
                if (!command.isEmpty()) {
                    LOGGER.trace("Received " + command);
                    writeToSocket(dispatcher.dispatch(command).toByteBuffer());
                }
            }
            readBuffer.compact();
        }
    }

    /** Make room for a frame larger than the buffer. */
    private void growReadBuffer() {
        final ByteBuffer larger = ByteBuffer.allocate(
                readBuffer.capacity() * 2);
        readBuffer.flip();
        larger.put(readBuffer);
        readBuffer = larger;
        LOGGER.trace("Read buffer grown to " + readBuffer.capacity());
    }

    private void writeToSocket(final ByteBuffer data) throws IOException {
        while (data.hasRemaining()) {
            socketChannel.write(data);
        }
    }

    private void writeBeforeClose(final Reply reply) {
        try {
            writeToSocket(reply.toByteBuffer());
        } catch (IOException e) {
            LOGGER.debug("Could not report error to client: "
                    + e.getMessage());
        }
    }

    private void close() {
        try {
            socketChannel.close();
        } catch (IOException e) {
            LOGGER.debug("IOException closing socketChannel: "
                    + e.getMessage());
        }
    }

    private String describePeer() {
        try {
            return String.valueOf(socketChannel.getRemoteAddress());
        } catch (IOException e) {
            return "<unknown>";
        }
    }
}
