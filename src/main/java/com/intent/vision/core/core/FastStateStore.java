package com.intent.vision.core.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Small key-value abstraction with TTL semantics, shared by every process that
 * serves the same organizations. Holds backend usage counters and alert
 * re-fire markers.
 *
 * Contracts:
 *  - All methods are thread-safe and atomic per key.
 *  - TTL of null or non-positive means "no expiry".
 *  - incr(...) creates the key with value=1 if absent or expired and only
 *    sets the TTL when the key is created.
 *  - decr(...) never takes a counter below zero.
 */
public interface FastStateStore {

    Optional<String> get(String key);

    void delete(String key);

    // Atomic "set if absent" with TTL (re-fire suppression)
    boolean setIfAbsent(String key, String value, Duration ttl);

    // Atomic counter (daily usage)
    long incr(String key, Duration ttlIfNew);

    long decr(String key);

    default long getLong(String key) {
        return get(key).map(v -> {
            try {
                return Long.parseLong(v);
            } catch (NumberFormatException ex) {
                return 0L;
            }
        }).orElse(0L);
    }
}
