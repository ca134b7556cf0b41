package kvserver.store;

import java.util.Arrays;

/** Value as held in the store, with an optional absolute expiry. */
final class StoreEntry {
    private final byte[] value;

    private final boolean expiring;

    /** Ticker reading in nanos at which the entry dies; unused if !expiring. */
    private final long expiresAtNanos;

    StoreEntry(final byte[] value) {
        this(value, false, 0L);
    }

    StoreEntry(final byte[] value, final long expiresAtNanos) {
        this(value, true, expiresAtNanos);
    }

    private StoreEntry(final byte[] value, final boolean expiring,
            final long expiresAtNanos) {
        assert (value != null);

        this.value = Arrays.copyOf(value, value.length);
        this.expiring = expiring;
        this.expiresAtNanos = expiresAtNanos;
    }

    byte[] copyValue() {
        return Arrays.copyOf(value, value.length);
    }

    /**
     * Ticker values may wrap, so compare by difference as System.nanoTime
     * requires.
     */
    boolean isExpired(final long nowNanos) {
        return expiring && nowNanos - expiresAtNanos >= 0;
    }
}
