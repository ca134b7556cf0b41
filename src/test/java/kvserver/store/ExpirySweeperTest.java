package kvserver.store;

import static org.junit.Assert.*;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import com.google.common.base.Ticker;

public class ExpirySweeperTest {
    @Test
    public final void testIterationRemovesExpiredOnly() {
        final ManualTicker ticker = new ManualTicker();
        final ExpiringStore store = new ExpiringStore(ticker);
        store.set("gone", "a".getBytes(), Duration.ofMillis(10));
        store.set("kept", "b".getBytes(), null);
        ticker.advance(Duration.ofMillis(10));

        new ExpirySweeper(store, 1000).runOneIteration();
        assertEquals(1, store.size());
        assertArrayEquals("b".getBytes(), store.get("kept"));
    }

    @Test
    public final void testScheduledSweepWithoutReads() throws Exception {
        final ExpiringStore store = new ExpiringStore(Ticker.systemTicker());
        store.set("gone", "a".getBytes(), Duration.ofMillis(20));

        final ExpirySweeper sweeper = new ExpirySweeper(store, 10);
        sweeper.startAsync().awaitRunning();
        try {
            final long deadline = System.nanoTime()
                    + TimeUnit.SECONDS.toNanos(5);
            while (store.size() != 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(0, store.size());
        } finally {
            sweeper.stopAsync().awaitTerminated();
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public final void testIntervalMustBePositive() {
        new ExpirySweeper(new ExpiringStore(new ManualTicker()), 0);
    }
}
