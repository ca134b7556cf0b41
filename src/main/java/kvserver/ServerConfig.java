package kvserver;

import java.util.Properties;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

/**
 * Server settings. Each one can be overridden by a JVM system property:
 * <ul>
 * <li>kvserver.address: bind address, default 0.0.0.0</li>
 * <li>kvserver.port: bind port, default 6379; 0 picks a free port</li>
 * <li>kvserver.maxConnections: concurrently served clients, default 1024</li>
 * <li>kvserver.sweepIntervalMillis: period of the background expiry sweep,
 *     default 100; 0 disables it</li>
 * </ul>
 */
public final class ServerConfig {
    static final String ADDRESS_PROPERTY = "kvserver.address";
    static final String PORT_PROPERTY = "kvserver.port";
    static final String MAX_CONNECTIONS_PROPERTY = "kvserver.maxConnections";
    static final String SWEEP_INTERVAL_PROPERTY =
            "kvserver.sweepIntervalMillis";

    public static final String DEFAULT_ADDRESS = "0.0.0.0";
    public static final int DEFAULT_PORT = 6379;
    public static final int DEFAULT_MAX_CONNECTIONS = 1024;
    public static final long DEFAULT_SWEEP_INTERVAL_MILLIS = 100;

    private final String address;
    private final int port;
    private final int maxConnections;
    private final long sweepIntervalMillis;

    public ServerConfig(final String address, final int port,
            final int maxConnections, final long sweepIntervalMillis) {
        Preconditions.checkNotNull(address);
        Preconditions.checkArgument(port >= 0 && port <= 65535,
                "port out of range: %s", port);
        Preconditions.checkArgument(maxConnections >= 1,
                "maxConnections must be at least 1: %s", maxConnections);
        Preconditions.checkArgument(sweepIntervalMillis >= 0,
                "sweepIntervalMillis cannot be negative: %s",
                sweepIntervalMillis);

        this.address = address;
        this.port = port;
        this.maxConnections = maxConnections;
        this.sweepIntervalMillis = sweepIntervalMillis;
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_ADDRESS, DEFAULT_PORT,
                DEFAULT_MAX_CONNECTIONS, DEFAULT_SWEEP_INTERVAL_MILLIS);
    }

    public static ServerConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    static ServerConfig fromProperties(final Properties properties) {
        return new ServerConfig(
                properties.getProperty(ADDRESS_PROPERTY, DEFAULT_ADDRESS),
                (int) parse(properties, PORT_PROPERTY, DEFAULT_PORT),
                (int) parse(properties, MAX_CONNECTIONS_PROPERTY,
                        DEFAULT_MAX_CONNECTIONS),
                parse(properties, SWEEP_INTERVAL_PROPERTY,
                        DEFAULT_SWEEP_INTERVAL_MILLIS));
    }

    private static long parse(final Properties properties, final String name,
            final long defaultValue) {
        final String raw = properties.getProperty(name);
        if (raw == null) {
            return defaultValue;
        }
        final Long value = Longs.tryParse(raw.trim());
        Preconditions.checkArgument(value != null
                && Ints.saturatedCast(value) == value,
                "invalid value for %s: %s", name, raw);
        return value;
    }

    public String getAddress() {
        return address;
    }

    public int getPort() {
        return port;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public long getSweepIntervalMillis() {
        return sweepIntervalMillis;
    }

    public boolean isSweepEnabled() {
        return sweepIntervalMillis > 0;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("address", address)
                .add("port", port)
                .add("maxConnections", maxConnections)
                .add("sweepIntervalMillis", sweepIntervalMillis)
                .toString();
    }
}
