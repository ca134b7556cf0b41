package kvserver.store;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;

/**
 * Store guarded by a single monitor over the whole map. Every operation,
 * including the lookup-then-remove of an expired key in get, runs under
 * that monitor, so all operations across connections are totally ordered.
 * Expired entries are removed lazily on access; {@link ExpirySweeper} may
 * additionally purge them in the background.
 */
public final class ExpiringStore implements Store {
    private static final Logger LOGGER = LogManager.getLogger(
            ExpiringStore.class);

    private final Map<String, StoreEntry> entries = new HashMap<>();

    private final Ticker ticker;

    public ExpiringStore(final Ticker ticker) {
        this.ticker = Preconditions.checkNotNull(ticker);
        LOGGER.trace("ExpiringStore created");
    }

    @Override
    public synchronized void set(final String key, final byte[] value,
            final Duration ttl) {
        Preconditions.checkNotNull(key);
        Preconditions.checkNotNull(value);

        if (ttl == null) {
            entries.put(key, new StoreEntry(value));
        } else {
            Preconditions.checkArgument(!ttl.isNegative() && !ttl.isZero(),
                    "ttl must be positive: %s", ttl);
            entries.put(key, new StoreEntry(value,
                    ticker.read() + ttl.toNanos()));
        }
        LOGGER.trace("Store set: key: " + key + " bytes: " + value.length
                + " ttl: " + ttl);
    }

    @Override
    public synchronized byte[] get(final String key) {
        Preconditions.checkNotNull(key);

        final StoreEntry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(ticker.read())) {
            entries.remove(key);
            LOGGER.trace("Store get: key: " + key + " expired, removed");
            return null;
        }
        return entry.copyValue();
    }

    @Override
    public synchronized int removeExpired() {
        final long now = ticker.read();
        int removed = 0;
        Iterator<StoreEntry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isExpired(now)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }
}
