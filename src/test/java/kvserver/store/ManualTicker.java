package kvserver.store;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Ticker;

/** Ticker that only moves when told to. */
public final class ManualTicker extends Ticker {
    private final AtomicLong nanos;

    public ManualTicker() {
        this(1_000_000L);
    }

    public ManualTicker(final long startNanos) {
        nanos = new AtomicLong(startNanos);
    }

    @Override
    public long read() {
        return nanos.get();
    }

    public void advance(final Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }
}
