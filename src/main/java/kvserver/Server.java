package kvserver;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.ServiceManager;

import kvserver.commands.CommandDispatcher;
import kvserver.store.ExpiringStore;
import kvserver.store.ExpirySweeper;
import kvserver.store.Store;

/**
 * Main entry point to this key-value server.
 * Creates the one store for the process lifetime, hands it to the services
 * that need it, starts them and ensures graceful shutdown upon termination.
 */
public final class Server {
    private static final Logger LOGGER = LogManager.getLogger(Server.class);

    private static final long STOP_TIMEOUT_SECONDS = 30;

    private final ServerConfig config;

    private final Store store;

    private final ConnectionManager connectionManager;

    private final ServiceManager serviceManager;

    public Server(final ServerConfig config) {
        this.config = Preconditions.checkNotNull(config);
        store = new ExpiringStore(Ticker.systemTicker());
        connectionManager = new ConnectionManager(config,
                new CommandDispatcher(store));

        final List<Service> services = new ArrayList<>();
        services.add(connectionManager);
        if (config.isSweepEnabled()) {
            services.add(new ExpirySweeper(store,
                    config.getSweepIntervalMillis()));
        }
        serviceManager = new ServiceManager(services);
        serviceManager.addListener(new ServiceManager.Listener() {
            @Override
            public void failure(final Service service) {
                LOGGER.error(service + " failed", service.failureCause());
            }
        }, MoreExecutors.directExecutor());
        LOGGER.trace("Server created: " + config);
    }

    /** Start all services and block until they are running. */
    public void start() {
        serviceManager.startAsync().awaitHealthy();
        LOGGER.info("Server started on port " + connectionManager.getPort());
    }

    /** Stop all services and block until they have terminated. */
    public void stop() {
        serviceManager.stopAsync();
        try {
            serviceManager.awaitStopped(STOP_TIMEOUT_SECONDS,
                    TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            LOGGER.warn("Services not stopped within timeout: "
                    + STOP_TIMEOUT_SECONDS + "s: "
                    + serviceManager.servicesByState());
        }
        LOGGER.info("Server stopped");
    }

    public int getPort() {
        return connectionManager.getPort();
    }

    Store getStore() {
        return store;
    }


    public static void main(final String[] args) {
        LOGGER.info("Server starting ...");
        final Server server = new Server(ServerConfig.fromSystemProperties());

        // Install shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(new Runnable() {
            @Override
            public void run() {
                server.stop();
            }
        }, "kvserver-shutdown"));

        server.start();
    }
}
