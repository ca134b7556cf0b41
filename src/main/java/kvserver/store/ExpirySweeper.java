package kvserver.store;

import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.AbstractScheduledService;

/**
 * Periodically purges expired entries so that keys nobody reads again do
 * not linger in memory. Lazy removal in {@link Store#get} stays the source
 * of correctness; this service only reclaims space.
 */
public final class ExpirySweeper extends AbstractScheduledService {
    private static final Logger LOGGER = LogManager.getLogger(
            ExpirySweeper.class);

    private final Store store;

    private final long intervalMillis;

    public ExpirySweeper(final Store store, final long intervalMillis) {
        Preconditions.checkArgument(intervalMillis > 0,
                "sweep interval must be positive: %s", intervalMillis);
        this.store = Preconditions.checkNotNull(store);
        this.intervalMillis = intervalMillis;
    }

    @Override
    protected void runOneIteration() {
        final int removed = store.removeExpired();
        if (removed != 0) {
            LOGGER.debug("Swept " + removed + " expired keys, "
                    + store.size() + " remaining");
        }
    }

    @Override
    protected Scheduler scheduler() {
        return Scheduler.newFixedDelaySchedule(intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
    }

    @Override
    protected String serviceName() {
        return "ExpirySweeper";
    }
}
