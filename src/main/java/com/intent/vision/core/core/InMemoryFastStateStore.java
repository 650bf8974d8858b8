package com.intent.vision.core.core;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-JVM implementation of FastStateStore built on compare-and-swap
 * over a concurrent map. Used for local runs and tests.
 */
public final class InMemoryFastStateStore implements FastStateStore {

    private static final class Entry {
        final String v;
        final long expAtMillis; // 0 = no expiry

        Entry(String v, long expAtMillis) {
            this.v = v;
            this.expAtMillis = expAtMillis;
        }
    }

    private final ConcurrentMap<String, Entry> map = new ConcurrentHashMap<>();
    private final String prefix;
    private final Clock clock;

    public InMemoryFastStateStore(String prefix, Clock clock) {
        this.prefix = prefix == null ? "" : prefix;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    private boolean isExpired(Entry e, long now) {
        return e != null && e.expAtMillis > 0 && now >= e.expAtMillis;
    }

    private static long expiry(Duration ttl, long now) {
        return (ttl == null || ttl.isZero() || ttl.isNegative()) ? 0L : now + ttl.toMillis();
    }

    private static long parse(String v) {
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public Optional<String> get(String key) {
        final String kk = k(key);
        final Entry e = map.get(kk);
        if (e == null) return Optional.empty();
        if (isExpired(e, clock.millis())) {
            map.remove(kk, e);
            return Optional.empty();
        }
        return Optional.ofNullable(e.v);
    }

    @Override
    public void delete(String key) {
        map.remove(k(key));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        final String kk = k(key);
        final long n = clock.millis();
        final Entry fresh = new Entry(value, expiry(ttl, n));

        for (; ; ) {
            final Entry existing = map.get(kk);
            if (existing == null) {
                if (map.putIfAbsent(kk, fresh) == null) {
                    return true;
                }
            } else if (isExpired(existing, n)) {
                if (map.replace(kk, existing, fresh)) {
                    return true;
                }
            } else {
                return false;
            }
            // lost race; retry
        }
    }

    @Override
    public long incr(String key, Duration ttlIfNew) {
        final String kk = k(key);
        final long n = clock.millis();

        for (; ; ) {
            final Entry cur = map.get(kk);
            if (cur == null || isExpired(cur, n)) {
                final Entry first = new Entry("1", expiry(ttlIfNew, n));
                boolean won = (cur == null) ? map.putIfAbsent(kk, first) == null : map.replace(kk, cur, first);
                if (won) {
                    return 1L;
                }
                continue;
            }
            final long next = parse(cur.v) + 1L;
            // keep the window the key was created with
            if (map.replace(kk, cur, new Entry(Long.toString(next), cur.expAtMillis))) {
                return next;
            }
        }
    }

    @Override
    public long decr(String key) {
        final String kk = k(key);
        final long n = clock.millis();

        for (; ; ) {
            final Entry cur = map.get(kk);
            if (cur == null || isExpired(cur, n)) {
                return 0L;
            }
            final long next = Math.max(0L, parse(cur.v) - 1L);
            if (map.replace(kk, cur, new Entry(Long.toString(next), cur.expAtMillis))) {
                return next;
            }
        }
    }
}
