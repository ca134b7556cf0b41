package kvserver.store;

import static org.junit.Assert.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.commons.lang3.RandomUtils;
import org.junit.Before;
import org.junit.Test;

import com.google.common.base.Ticker;

public class ExpiringStoreTest {
    private ManualTicker ticker;

    private ExpiringStore store;

    @Before
    public void setUp() {
        ticker = new ManualTicker();
        store = new ExpiringStore(ticker);
    }

    @Test
    public final void testGetExists() {
        for (int i = 1; i <= 10; i++) {
            final String key = "hello-" + i;
            final byte[] data = RandomUtils.nextBytes(
                    RandomUtils.nextInt(0, 1024));

            store.set(key, data, null);
            assertArrayEquals(data, store.get(key));
        }
        assertEquals(10, store.size());
    }

    @Test
    public final void testGetNotExists() {
        store.set("hello", RandomUtils.nextBytes(10), null);
        assertNull(store.get("hello-dummy"));
    }

    @Test
    public final void testSetOverwrites() {
        store.set("key", "first".getBytes(), Duration.ofSeconds(1));
        store.set("key", "second".getBytes(), null);

        // The overwrite dropped the expiry of the first value.
        ticker.advance(Duration.ofHours(1));
        assertArrayEquals("second".getBytes(), store.get("key"));
        assertEquals(1, store.size());
    }

    @Test
    public final void testBinaryValueUnchanged() {
        final byte[] data = new byte[256];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) i;
        }
        store.set("bin", data, null);
        assertArrayEquals(data, store.get("bin"));
    }

    @Test
    public final void testValueCopiedInAndOut() {
        final byte[] data = {1, 2, 3};
        store.set("key", data, null);
        data[0] = 9;

        final byte[] fetched = store.get("key");
        assertArrayEquals(new byte[] {1, 2, 3}, fetched);
        fetched[1] = 9;
        assertArrayEquals(new byte[] {1, 2, 3}, store.get("key"));
    }

    @Test
    public final void testLiveBeforeExpiry() {
        store.set("key", "value".getBytes(), Duration.ofMillis(100));
        ticker.advance(Duration.ofMillis(99));
        assertArrayEquals("value".getBytes(), store.get("key"));
    }

    @Test
    public final void testExpiredAtDeadlineAndRemoved() {
        store.set("key", "value".getBytes(), Duration.ofMillis(100));
        ticker.advance(Duration.ofMillis(100));

        assertEquals(1, store.size());
        assertNull(store.get("key"));
        assertEquals(0, store.size());
    }

    @Test
    public final void testExpiryAcrossTickerOverflow() {
        ticker = new ManualTicker(Long.MAX_VALUE - 10);
        store = new ExpiringStore(ticker);

        store.set("key", "value".getBytes(), Duration.ofNanos(100));
        ticker.advance(Duration.ofNanos(50));
        assertNotNull(store.get("key"));
        ticker.advance(Duration.ofNanos(50));
        assertNull(store.get("key"));
    }

    @Test(expected = IllegalArgumentException.class)
    public final void testZeroTtlRejected() {
        store.set("key", "value".getBytes(), Duration.ZERO);
    }

    @Test
    public final void testRemoveExpired() {
        store.set("short", "a".getBytes(), Duration.ofSeconds(1));
        store.set("long", "b".getBytes(), Duration.ofSeconds(10));
        store.set("forever", "c".getBytes(), null);

        assertEquals(0, store.removeExpired());
        ticker.advance(Duration.ofSeconds(5));
        assertEquals(1, store.removeExpired());
        assertEquals(2, store.size());
        assertNull(store.get("short"));
        assertNotNull(store.get("long"));
        assertNotNull(store.get("forever"));
    }

    /**
     * Writers keep replacing one key with values of different lengths whose
     * bytes are all the same; a reader must only ever see a value some
     * writer actually stored.
     */
    @Test
    public final void testNoTornReads() throws Exception {
        store = new ExpiringStore(Ticker.systemTicker());
        final int writers = 4;
        final int rounds = 2000;
        final Set<String> written = new HashSet<>();
        for (int w = 0; w < writers; w++) {
            written.add(valueFor(w));
        }
        store.set("k", valueFor(0).getBytes(), null);

        final ExecutorService service = Executors.newFixedThreadPool(
                writers + 1);
        final AtomicBoolean done = new AtomicBoolean(false);
        final List<Future<?>> writerFutures = new LinkedList<>();
        for (int w = 0; w < writers; w++) {
            final byte[] value = valueFor(w).getBytes();
            writerFutures.add(service.submit(new Runnable() {
                @Override
                public void run() {
                    for (int i = 0; i < rounds; i++) {
                        store.set("k", value, null);
                    }
                }
            }));
        }
        final Future<List<String>> reader = service.submit(
                new Callable<List<String>>() {
                    @Override
                    public List<String> call() {
                        final List<String> seen = new ArrayList<>();
                        while (!done.get()) {
                            seen.add(new String(store.get("k")));
                        }
                        return seen;
                    }
                });

        for (Future<?> f : writerFutures) {
            f.get();
        }
        done.set(true);
        for (String value : reader.get()) {
            assertTrue("torn read: " + value, written.contains(value));
        }
        service.shutdown();
        assertTrue(service.awaitTermination(10, TimeUnit.SECONDS));
    }

    private static String valueFor(final int writer) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i <= writer * 100; i++) {
            sb.append((char) ('a' + writer));
        }
        return sb.toString();
    }
}
