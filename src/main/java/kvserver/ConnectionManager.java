package kvserver;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.AbstractIdleService;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import kvserver.commands.CommandDispatcher;
import kvserver.commands.ConnectionHandler;
import kvserver.protocol.Reply;
import kvserver.protocol.RespDecoder;

/**
 * Service that accepts client connections and serves each one on its own
 * worker thread with a {@link ConnectionHandler}.
 * Workers come from a pool capped at the configured connection limit; a
 * client arriving while every worker is busy gets an error reply and is
 * disconnected straight away.
 * All workers share the dispatcher, and through it the one store.
 */
public final class ConnectionManager extends AbstractIdleService {
    private static final Logger LOGGER = LogManager.getLogger(
            ConnectionManager.class);

    private static final long KEEP_ALIVE_SECONDS = 60;

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    static final Reply TOO_MANY_CLIENTS = Reply.error(
            "max number of clients reached");

    private final ServerConfig config;

    private final CommandDispatcher dispatcher;

    private final RespDecoder decoder = new RespDecoder();

    private final ExecutorService acceptExecutor =
            Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                    .setNameFormat("kvserver-accept-%d").build());

    private final ThreadPoolExecutor workerThreads;

    /** Open client channels, closed on shutdown to unblock their readers. */
    private final Set<SocketChannel> clients = ConcurrentHashMap.newKeySet();

    private ServerSocketChannel serverSocket;

    private volatile int boundPort = -1;

    public ConnectionManager(final ServerConfig config,
            final CommandDispatcher dispatcher) {
        this.config = Preconditions.checkNotNull(config);
        this.dispatcher = Preconditions.checkNotNull(dispatcher);

        workerThreads = new ThreadPoolExecutor(0, config.getMaxConnections(),
                KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
                new SynchronousQueue<Runnable>(),
                new ThreadFactoryBuilder()
                        .setNameFormat("kvserver-client-%d").build());
        LOGGER.trace("ConnectionManager created: " + config);
    }

    /** Port actually bound; differs from the configured one if that was 0. */
    public int getPort() {
        Preconditions.checkState(boundPort >= 0, "not listening yet");
        return boundPort;
    }

    public int getActiveConnectionCount() {
        return clients.size();
    }

    private void configureServerSocket() throws IOException {
        serverSocket = ServerSocketChannel.open();
        // If the server shutdown and restarts immediately, then tell the
        // kernel to reuse this address even though its state is in TIME_WAIT.
        serverSocket.setOption(StandardSocketOptions.SO_REUSEADDR, true);
        serverSocket.bind(new InetSocketAddress(config.getAddress(),
                config.getPort()));
        boundPort = ((InetSocketAddress) serverSocket.getLocalAddress())
                .getPort();
    }

    private void handleNewConnection(final SocketChannel client) {
        final String peer = describePeer(client);
        try {
            client.setOption(StandardSocketOptions.TCP_NODELAY, true);
        } catch (IOException e) {
            LOGGER.debug("Dropping client " + peer + ": " + e.getMessage());
            closeQuietly(client);
            return;
        }
        LOGGER.debug("Accepted client: " + peer);

        clients.add(client);
        try {
            workerThreads.execute(new ConnectionHandler(client, decoder,
                    dispatcher, new Runnable() {
                        @Override
                        public void run() {
                            clients.remove(client);
                        }
                    }));
        } catch (RejectedExecutionException e) {
            clients.remove(client);
            LOGGER.warn("Rejecting client " + peer + ": all "
                    + config.getMaxConnections() + " workers busy");
            rejectConnection(client);
        }
    }

    private static void rejectConnection(final SocketChannel client) {
        try {
            final ByteBuffer data = TOO_MANY_CLIENTS.toByteBuffer();
            while (data.hasRemaining()) {
                client.write(data);
            }
        } catch (IOException e) {
            LOGGER.debug("Could not notify rejected client: "
                    + e.getMessage());
        } finally {
            closeQuietly(client);
        }
    }

    private static void closeQuietly(final SocketChannel client) {
        try {
            client.close();
        } catch (IOException e) {
            LOGGER.debug("IOException closing client: " + e.getMessage());
        }
    }

    private static String describePeer(final SocketChannel client) {
        try {
            return String.valueOf(client.getRemoteAddress());
        } catch (IOException e) {
            return "<unknown>";
        }
    }

    void listenToSockets() {
        LOGGER.info("ConnectionManager listening on " + config.getAddress()
                + ":" + boundPort);
        while (true) {
            try {
                // Blocking call
                handleNewConnection(serverSocket.accept());
            } catch (ClosedChannelException e) {
                // Shutdown closed the server socket. Gracefully break out.
                break;
            } catch (IOException e) {
                if (!serverSocket.isOpen()) {
                    break;
                }
                LOGGER.warn("Failed to accept client connection", e);
            }
        }
        LOGGER.info("ConnectionManager stopped listening");
    }

    @Override
    protected void startUp() throws IOException {
        LOGGER.trace("Connection Manager starting ...");
        configureServerSocket();
        acceptExecutor.execute(new Runnable() {
            @Override
            public void run() {
                listenToSockets();
            }
        });
        LOGGER.trace("Connection Manager started");
    }

    /**
     * Shutdown the ConnectionManager service gracefully.
     * First close the server socket, stopping new connections.
     * Then close every client channel, which unblocks the workers reading
     * from them.
     * Finally, wait for the accept thread and the workers to finish.
     */
    @Override
    protected void shutDown() throws InterruptedException, IOException {
        LOGGER.debug("Connection Manager shutting down ...");
        if (serverSocket != null) {
            serverSocket.close();
        }
        acceptExecutor.shutdown();
        if (!acceptExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS,
                TimeUnit.SECONDS)) {
            LOGGER.warn("Accept thread cannot be shut down within timeout: "
                    + SHUTDOWN_TIMEOUT_SECONDS + "s");
        }

        for (SocketChannel client : clients) {
            LOGGER.trace("closing client: " + client);
            closeQuietly(client);
        }

        workerThreads.shutdown();
        if (!workerThreads.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS,
                TimeUnit.SECONDS)) {
            LOGGER.warn("WorkerThreads cannot be shut down within timeout: "
                    + SHUTDOWN_TIMEOUT_SECONDS + "s");
        }
        LOGGER.info("Connection Manager shut down");
    }

    @Override
    protected String serviceName() {
        return "ConnectionManager";
    }
}
