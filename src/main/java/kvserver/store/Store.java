package kvserver.store;

import java.time.Duration;

/** Key-value store shared by every client connection. */
public interface Store {
    /**
     * Set the given value for the given key, replacing any previous entry.
     *
     * @param key store key
     * @param value value bytes; copied by the store.
     * @param ttl time to live; null if the entry never expires.
     */
    void set(String key, byte[] value, Duration ttl);

    /**
     * Fetch the value for the key. An entry whose expiry has passed is
     * removed and reported as absent.
     *
     * @param key store key
     * @return copy of the value if present and live; null otherwise.
     */
    byte[] get(String key);

    /**
     * Remove every entry whose expiry has passed.
     *
     * @return number of entries removed.
     */
    int removeExpired();

    /** Number of entries held, including expired ones not yet removed. */
    int size();
}
